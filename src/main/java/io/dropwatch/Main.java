package io.dropwatch;

import io.dropwatch.cli.DropWatchCommand;
import io.dropwatch.util.Jsons;
import picocli.CommandLine;

import java.util.Map;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /**
     * Operator mistakes and busy leases print as {@code {"error": "..."}} with exit code 1; anything else
     * keeps picocli's default handling.
     */
    public static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new DropWatchCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException || ex instanceof IllegalStateException) {
                System.out.println(Jsons.toCompactJson(Map.of("error", String.valueOf(ex.getMessage()))));
                return 1;
            }
            throw ex;
        });
        return cmd;
    }
}
