package io.dropwatch.worker;

import io.dropwatch.model.Deposit;

public record PollResult(State state, Deposit deposit, String detail) {
    public enum State { DEPOSITED, RUNNING, UNRESPONSIVE }

    public static PollResult deposited(Deposit deposit) {
        return new PollResult(State.DEPOSITED, deposit, null);
    }

    public static PollResult running() {
        return new PollResult(State.RUNNING, null, null);
    }

    public static PollResult running(String detail) {
        return new PollResult(State.RUNNING, null, detail);
    }

    public static PollResult unresponsive(String detail) {
        return new PollResult(State.UNRESPONSIVE, null, detail);
    }
}
