package io.dropwatch.validation;

public record Finding(String type, String message, int line, String content) {
}
