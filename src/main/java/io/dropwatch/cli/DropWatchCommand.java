package io.dropwatch.cli;

import io.dropwatch.config.DropWatchConfig;
import io.dropwatch.control.ControlState;
import io.dropwatch.recovery.ResolutionVerdict;
import io.dropwatch.runtime.DropWatchRuntime;
import io.dropwatch.runtime.TickScheduler;
import io.dropwatch.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "dropwatch",
        mixinStandardHelpOptions = true,
        description = "Supervises builds of drops executed by external workers",
        subcommands = {
                DropWatchCommand.InitCommand.class,
                DropWatchCommand.CreateCommand.class,
                DropWatchCommand.BuildsCommand.class,
                DropWatchCommand.StatusCommand.class,
                DropWatchCommand.TickCommand.class,
                DropWatchCommand.ControlCommand.class,
                DropWatchCommand.ValidateCommand.class,
                DropWatchCommand.ScanCommand.class,
                DropWatchCommand.ReportCommand.class,
                DropWatchCommand.RetryCommand.class,
                DropWatchCommand.ResolveCommand.class,
                DropWatchCommand.ResumeCommand.class,
                DropWatchCommand.PauseCommand.class,
                DropWatchCommand.AbandonCommand.class,
                DropWatchCommand.LessonsCommand.class,
                DropWatchCommand.RecoveryLogCommand.class,
                DropWatchCommand.AuditTailCommand.class,
                DropWatchCommand.LeaseConflictsCommand.class
        }
)
public final class DropWatchCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = DropWatchConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | create | builds | status | tick | control | validate | scan | report | retry | resolve | resume | pause | abandon | lessons | recovery-log | audit-tail | lease-conflicts");
    }

    DropWatchRuntime runtime() {
        DropWatchRuntime runtime = new DropWatchRuntime(DropWatchConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Override
        public Integer call() {
            DropWatchRuntime runtime = parent.runtime();
            System.out.println("Initialized DropWatch at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "create", description = "Create a build from a plan JSON file")
    static final class CreateCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Parameters(index = "0", description = "Plan JSON file")
        String plan;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().createBuild(Path.of(plan))));
            return 0;
        }
    }

    @Command(name = "builds", description = "List builds")
    static final class BuildsCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().builds()));
            return 0;
        }
    }

    @Command(name = "status", description = "Show build, waves, drops, lease and spawn circuit")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Parameters(index = "0", description = "Build slug")
        String slug;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().status(slug)));
            return 0;
        }
    }

    @Command(name = "tick", description = "Run one supervisory cycle over every active build")
    static final class TickCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Plan the pass and recovery without writing")
        boolean dryRun;

        @Option(names = {"--holder"}, defaultValue = "tick", description = "Lease holder prefix")
        String holder;

        @Override
        public Integer call() {
            TickScheduler.TickReport report = parent.runtime().tick(holder, dryRun);
            System.out.println(Jsons.toJson(report));
            return report.exitCode();
        }
    }

    @Command(name = "control", description = "Show or set the control state: active|paused|stopped")
    static final class ControlCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "New state")
        String state;

        @Override
        public Integer call() {
            DropWatchRuntime runtime = parent.runtime();
            Object out = state == null ? runtime.control() : runtime.control(ControlState.parse(state));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "validate", description = "Re-validate the current deposit of a drop (writes a new report)")
    static final class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Parameters(index = "0", description = "Build slug")
        String slug;

        @Parameters(index = "1", description = "Drop id")
        String dropId;

        @Override
        public Integer call() {
            DropWatchRuntime.ReportOutcome out = parent.runtime().validate(slug, dropId);
            System.out.println(Jsons.toJson(out));
            return out.passed() ? 0 : 1;
        }
    }

    @Command(name = "scan", description = "Scan a directory for stub markers")
    static final class ScanCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Parameters(index = "0", description = "Directory to scan")
        String path;

        @Option(names = {"--ext"}, split = ",", description = "File extensions, e.g. .py,.ts")
        List<String> extensions;

        @Override
        public Integer call() {
            DropWatchRuntime.ReportOutcome out = parent.runtime().scan(Path.of(path), extensions);
            System.out.println(Jsons.toJson(out));
            return out.passed() ? 0 : 1;
        }
    }

    @Command(name = "report", description = "Validate every current deposit of a build")
    static final class ReportCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Parameters(index = "0", description = "Build slug")
        String slug;

        @Override
        public Integer call() {
            DropWatchRuntime.ReportOutcome out = parent.runtime().auditBuild(slug);
            System.out.println(Jsons.toJson(out));
            return out.passed() ? 0 : 1;
        }
    }

    @Command(name = "retry", description = "Reset a failed or dead drop to pending")
    static final class RetryCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Parameters(index = "0", description = "Build slug")
        String slug;

        @Parameters(index = "1", description = "Drop id")
        String dropId;

        @Option(names = {"--reason"}, description = "Note passed to the next worker")
        String reason;

        @Override
        public Integer call() {
            DropWatchRuntime.DropActionOutcome out = parent.runtime().retry(slug, dropId, reason);
            System.out.println(Jsons.toJson(out));
            return out.applied() ? 0 : 1;
        }
    }

    @Command(name = "resolve", description = "Record a reviewer verdict for a needs-judgment drop")
    static final class ResolveCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Parameters(index = "0", description = "Build slug")
        String slug;

        @Parameters(index = "1", description = "Drop id")
        String dropId;

        @Option(names = {"--verdict"}, required = true, description = "accept|retry|reject")
        String verdict;

        @Option(names = {"--note"}, description = "Reviewer note")
        String note;

        @Override
        public Integer call() {
            DropWatchRuntime.DropActionOutcome out =
                    parent.runtime().resolve(slug, dropId, ResolutionVerdict.parse(verdict), note);
            System.out.println(Jsons.toJson(out));
            return out.applied() ? 0 : 1;
        }
    }

    @Command(name = "resume", description = "Set a blocked or paused build back to active")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Parameters(index = "0", description = "Build slug")
        String slug;

        @Override
        public Integer call() {
            DropWatchRuntime.BuildActionOutcome out = parent.runtime().resume(slug);
            System.out.println(Jsons.toJson(out));
            return out.applied() ? 0 : 1;
        }
    }

    @Command(name = "pause", description = "Pause an active build")
    static final class PauseCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Parameters(index = "0", description = "Build slug")
        String slug;

        @Override
        public Integer call() {
            DropWatchRuntime.BuildActionOutcome out = parent.runtime().pause(slug);
            System.out.println(Jsons.toJson(out));
            return out.applied() ? 0 : 1;
        }
    }

    @Command(name = "abandon", description = "Mark a build failed and archive it")
    static final class AbandonCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Parameters(index = "0", description = "Build slug")
        String slug;

        @Option(names = {"--reason"}, description = "Reason recorded on the build")
        String reason;

        @Override
        public Integer call() {
            DropWatchRuntime.BuildActionOutcome out = parent.runtime().abandon(slug, reason);
            System.out.println(Jsons.toJson(out));
            return out.applied() ? 0 : 1;
        }
    }

    @Command(name = "lessons", description = "Tail the system learnings log")
    static final class LessonsCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().lessons(limit)));
            return 0;
        }
    }

    @Command(name = "recovery-log", description = "List recorded recovery decisions of a build")
    static final class RecoveryLogCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Parameters(index = "0", description = "Build slug")
        String slug;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().recoveryLog(slug, limit)));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print last audit log lines")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Option(names = {"--lines"}, defaultValue = "20", description = "Line count")
        int lines;

        @Override
        public Integer call() {
            parent.runtime().auditTail(lines).forEach(System.out::println);
            return 0;
        }
    }

    @Command(name = "lease-conflicts", description = "List busy lease acquisitions and stale-lease writes")
    static final class LeaseConflictsCommand implements Callable<Integer> {
        @ParentCommand
        DropWatchCommand parent;

        @Parameters(index = "0", description = "Build slug")
        String slug;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().leaseConflicts(slug, limit)));
            return 0;
        }
    }
}
