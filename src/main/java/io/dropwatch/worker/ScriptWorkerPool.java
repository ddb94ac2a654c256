package io.dropwatch.worker;

import io.dropwatch.config.DropWatchConfig;
import io.dropwatch.model.Deposit;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs each drop as a detached local process.
 *
 * <p>The brief goes to the process on stdin; the deposit path and ids are passed as environment
 * variables. The scheduler is short-lived, so the worker handle is just {@code pid:<pid>} and
 * liveness is checked through {@link ProcessHandle} on the next poll.
 */
public final class ScriptWorkerPool implements WorkerPool {
    public static final String ENV_BUILD = "DROPWATCH_BUILD";
    public static final String ENV_DROP = "DROPWATCH_DROP";
    public static final String ENV_DEPOSIT_PATH = "DROPWATCH_DEPOSIT_PATH";
    public static final String ENV_ATTEMPT = "DROPWATCH_ATTEMPT";
    private static final String HANDLE_PREFIX = "pid:";
    private static final int MAX_ERROR_CHARS = 512;

    private final List<String> command;
    private final DropWatchConfig config;
    private final DepositInbox inbox;

    public ScriptWorkerPool(List<String> command, DropWatchConfig config, DepositInbox inbox) {
        this.command = command == null ? List.of() : List.copyOf(command);
        this.config = config;
        this.inbox = inbox;
    }

    @Override
    public SpawnResult spawn(SpawnRequest request) {
        if (command.isEmpty()) {
            return SpawnResult.fail("spawn error: no worker command configured");
        }
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        Map<String, String> env = pb.environment();
        env.put(ENV_BUILD, request.buildSlug());
        env.put(ENV_DROP, request.dropId());
        env.put(ENV_DEPOSIT_PATH, request.depositPath().toString());
        env.put(ENV_ATTEMPT, Integer.toString(request.attempt()));
        pb.redirectErrorStream(true);
        Process process;
        try {
            Path logDir = config.workerLogsDir(request.buildSlug());
            Files.createDirectories(logDir);
            Files.createDirectories(request.depositPath().getParent());
            pb.redirectOutput(ProcessBuilder.Redirect.appendTo(logDir.resolve(request.dropId() + ".log").toFile()));
            process = pb.start();
        } catch (IOException e) {
            return SpawnResult.fail("spawn error: " + truncate(e.getMessage()));
        }

        try (OutputStream stdin = process.getOutputStream()) {
            byte[] input = request.brief() == null
                    ? new byte[0]
                    : request.brief().getBytes(StandardCharsets.UTF_8);
            stdin.write(input);
            stdin.flush();
        } catch (IOException e) {
            if (!process.isAlive() && process.exitValue() != 0) {
                return SpawnResult.fail("spawn error: worker exited with " + process.exitValue());
            }
            // Worker closed stdin early; it is still running and may deposit.
        }
        return SpawnResult.ok(HANDLE_PREFIX + process.pid());
    }

    @Override
    public PollResult poll(String buildSlug, String dropId, String workerHandle) {
        Optional<Deposit> deposit = inbox.read(buildSlug, dropId);
        if (deposit.isPresent() && !deposit.get().malformed()) {
            return PollResult.deposited(deposit.get());
        }
        Optional<Long> pid = parsePid(workerHandle);
        boolean alive = pid.flatMap(ProcessHandle::of).map(ProcessHandle::isAlive).orElse(false);
        if (alive) {
            return deposit.isPresent()
                    ? PollResult.running("deposit not readable yet: " + deposit.get().summary())
                    : PollResult.running();
        }
        if (pid.isEmpty() && deposit.isEmpty()) {
            return PollResult.unresponsive("unknown worker handle: " + workerHandle);
        }
        // Re-check: the worker may have deposited between the first read and exiting.
        deposit = inbox.read(buildSlug, dropId);
        return deposit.map(PollResult::deposited)
                .orElseGet(() -> PollResult.unresponsive("worker " + workerHandle + " exited without a deposit"));
    }

    static Optional<Long> parsePid(String handle) {
        if (handle == null || !handle.startsWith(HANDLE_PREFIX)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(handle.substring(HANDLE_PREFIX.length())));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
