package com.docqueue.app;

import com.docqueue.config.QueueConfig;
import com.docqueue.core.ArtifactKind;
import com.docqueue.core.ClaimedJob;
import com.docqueue.core.JobState;
import com.docqueue.core.JobStatusInfo;
import com.docqueue.core.QueueException;
import com.docqueue.engine.Scheduler;
import com.docqueue.engine.Worker;
import com.docqueue.engine.WorkerOutcome;
import com.docqueue.jobs.OcrTriageProcessor;
import com.docqueue.store.JobStore;
import com.docqueue.store.PathResolver;
import com.docqueue.store.QueueLayout;
import com.docqueue.store.QueueStats;
import com.docqueue.store.StateStats;
import com.docqueue.store.StatsCollector;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line entry point.
 *
 * <p>Every subcommand works on a queue root given as its first argument.
 * Commands that take nothing else fall back to {@code docqueue.root} when the
 * root is omitted. Exit codes:</p>
 * <ul>
 *   <li>0 success</li>
 *   <li>2 not found (nothing to claim, unknown job)</li>
 *   <li>1 invalid argument, I/O failure or usage error</li>
 * </ul>
 * <p>Command output goes to stdout, logs to stderr.</p>
 */
@Command(
        name = "docqueue",
        mixinStandardHelpOptions = true,
        version = "docqueue 1.0.0",
        description = "Filesystem job queue for document processing",
        subcommands = {
                Main.InitCommand.class,
                Main.SubmitCommand.class,
                Main.ClaimCommand.class,
                Main.ReleaseCommand.class,
                Main.FinalizeCommand.class,
                Main.MoveCommand.class,
                Main.StatusCommand.class,
                Main.StatsCommand.class,
                Main.ProcessCommand.class,
                Main.ServeCommand.class
        }
)
public final class Main implements Runnable {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_NOT_FOUND = 2;

    @Spec
    CommandSpec spec;

    private QueueConfig config;

    public Main() {
    }

    Main(QueueConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        configureLogging();
        System.exit(newCommandLine(new Main()).execute(args));
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getErr());
    }

    /**
     * Build the command line with the queue's exit-code conventions and state
     * name conversion installed.
     *
     * @param main the root command
     * @return a ready-to-execute command line
     */
    static CommandLine newCommandLine(Main main) {
        CommandLine commandLine = new CommandLine(main);
        commandLine.registerConverter(JobState.class, value -> {
            JobState state = JobState.fromLabel(value);
            if (state == null) {
                throw new CommandLine.TypeConversionException(
                        "invalid state '" + value + "' (expected jobs, priority, complete or error)");
            }
            return state;
        });
        commandLine.setParameterExceptionHandler((ex, args) -> {
            PrintWriter err = ex.getCommandLine().getErr();
            err.println(ex.getMessage());
            ex.getCommandLine().usage(err);
            return EXIT_FAILURE;
        });
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof QueueException) {
                QueueException queueError = (QueueException) ex;
                cmd.getErr().println("error: " + queueError.getMessage());
                return queueError.getKind().getExitCode();
            }
            if (ex instanceof IllegalArgumentException) {
                cmd.getErr().println("error: " + ex.getMessage());
                return EXIT_FAILURE;
            }
            logger.log(Level.SEVERE, "Command failed", ex);
            cmd.getErr().println("error: " + ex);
            return EXIT_FAILURE;
        });
        return commandLine;
    }

    // Use the bundled logging.properties unless the JVM was given its own
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging.properties: " + e.getMessage());
        }
    }

    QueueConfig config() {
        if (config == null) {
            config = QueueConfig.load();
        }
        return config;
    }

    QueueLayout layout(Path root) {
        Path effective = root != null ? root : config().getRoot();
        return new QueueLayout(effective, new PathResolver(config().getMaxPathLength()));
    }

    JobStore store(Path root) {
        return new JobStore(layout(root));
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    @Command(name = "init", description = "Create the queue root and its state directories")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        Main parent;

        @Parameters(index = "0", arity = "0..1", description = "Queue root (default: docqueue.root)")
        Path root;

        @Override
        public Integer call() throws QueueException {
            QueueLayout layout = parent.layout(root);
            layout.initialize();
            parent.out().println("initialized " + layout.getRoot());
            return EXIT_OK;
        }
    }

    @Command(name = "submit", description = "Copy a primary file and its metadata into the queue")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        Main parent;

        @Parameters(index = "0", description = "Queue root")
        Path root;

        @Parameters(index = "1", description = "Job id")
        String uuid;

        @Parameters(index = "2", description = "Primary (PDF) file to copy")
        Path pdf;

        @Parameters(index = "3", description = "Metadata file to copy")
        Path metadata;

        @Option(names = {"--priority"}, description = "Submit to priority_jobs")
        boolean priority;

        @Override
        public Integer call() throws QueueException {
            JobState state = parent.store(root).submit(uuid, pdf, metadata, priority);
            parent.out().println("submitted " + uuid + " " + state.getLabel());
            return EXIT_OK;
        }
    }

    @Command(name = "claim", description = "Claim the next job and print '<uuid> <state>'")
    static final class ClaimCommand implements Callable<Integer> {
        @ParentCommand
        Main parent;

        @Parameters(index = "0", arity = "0..1", description = "Queue root (default: docqueue.root)")
        Path root;

        @Option(names = {"--prefer-priority"}, description = "Scan priority_jobs before jobs")
        boolean preferPriority;

        @Override
        public Integer call() throws QueueException {
            Optional<ClaimedJob> claimed = parent.store(root).claimNext(preferPriority);
            if (claimed.isEmpty()) {
                parent.err().println("no jobs");
                return EXIT_NOT_FOUND;
            }
            parent.out().println(claimed.get());
            return EXIT_OK;
        }
    }

    @Command(name = "release", description = "Give a claimed job back to its queue")
    static final class ReleaseCommand implements Callable<Integer> {
        @ParentCommand
        Main parent;

        @Parameters(index = "0", description = "Queue root")
        Path root;

        @Parameters(index = "1", description = "Job id")
        String uuid;

        @Parameters(index = "2", description = "State the job was claimed in")
        JobState state;

        @Override
        public Integer call() throws QueueException {
            parent.store(root).release(uuid, state);
            parent.out().println("released " + uuid);
            return EXIT_OK;
        }
    }

    @Command(name = "finalize", description = "Move a claimed job to its outcome state and unlock it")
    static final class FinalizeCommand implements Callable<Integer> {
        @ParentCommand
        Main parent;

        @Parameters(index = "0", description = "Queue root")
        Path root;

        @Parameters(index = "1", description = "Job id")
        String uuid;

        @Parameters(index = "2", description = "State the job was claimed in")
        JobState from;

        @Parameters(index = "3", description = "Target state, usually complete or error")
        JobState to;

        @Override
        public Integer call() throws QueueException {
            parent.store(root).finalizeJob(uuid, from, to);
            parent.out().println("finalized " + uuid + " " + to.getLabel());
            return EXIT_OK;
        }
    }

    @Command(name = "move", description = "Move an unlocked job between states")
    static final class MoveCommand implements Callable<Integer> {
        @ParentCommand
        Main parent;

        @Parameters(index = "0", description = "Queue root")
        Path root;

        @Parameters(index = "1", description = "Job id")
        String uuid;

        @Parameters(index = "2", description = "Current state")
        JobState from;

        @Parameters(index = "3", description = "Target state")
        JobState to;

        @Override
        public Integer call() throws QueueException {
            parent.store(root).move(uuid, from, to);
            parent.out().println("moved " + uuid + " " + to.getLabel());
            return EXIT_OK;
        }
    }

    @Command(name = "status", description = "Print 'state=<s> locked=<0|1>' for a job")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        Main parent;

        @Parameters(index = "0", description = "Queue root")
        Path root;

        @Parameters(index = "1", description = "Job id")
        String uuid;

        @Override
        public Integer call() throws QueueException {
            Optional<JobStatusInfo> status = parent.store(root).status(uuid);
            if (status.isEmpty()) {
                parent.err().println("job not found");
                return EXIT_NOT_FOUND;
            }
            parent.out().println(status.get());
            return EXIT_OK;
        }
    }

    @Command(name = "stats", description = "Print file counts per state")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        Main parent;

        @Parameters(index = "0", arity = "0..1", description = "Queue root (default: docqueue.root)")
        Path root;

        @Option(names = {"--json"}, description = "Print the stats as JSON")
        boolean json;

        @Override
        public Integer call() throws QueueException {
            QueueStats stats = new StatsCollector(parent.layout(root)).collect();
            PrintWriter out = parent.out();
            if (json) {
                out.println(stats.toJson().toString(2));
                return EXIT_OK;
            }
            for (StateStats state : stats.getStates().values()) {
                out.println(formatState(state));
            }
            out.println("total files=" + stats.getTotalFiles()
                    + " locked=" + stats.getTotalLocked()
                    + " orphans=" + stats.getTotalOrphans()
                    + " bytes=" + stats.getTotalBytes()
                    + " pairs=" + stats.getTotalPairs()
                    + " locked_pairs=" + stats.getTotalLockedPairs()
                    + " oldest_mtime=" + stats.getOldestMtime()
                    + " newest_mtime=" + stats.getNewestMtime());
            return EXIT_OK;
        }

        private static String formatState(StateStats state) {
            StringBuilder line = new StringBuilder(state.getState().getLabel());
            for (ArtifactKind kind : ArtifactKind.values()) {
                line.append(' ').append(kind.getLabel()).append('=').append(state.getUnlocked(kind));
                line.append(' ').append(kind.getLabel()).append("_locked=").append(state.getLocked(kind));
            }
            line.append(" pairs=").append(state.getPairs());
            line.append(" locked_pairs=").append(state.getLockedPairs());
            line.append(" orphans=").append(state.getOrphanCount());
            line.append(" bytes=").append(state.getTotalBytes());
            return line.toString();
        }
    }

    @Command(name = "process", description = "Run the built-in OCR triage processor on queued jobs")
    static final class ProcessCommand implements Callable<Integer> {
        @ParentCommand
        Main parent;

        @Parameters(index = "0", arity = "0..1", description = "Queue root (default: docqueue.root)")
        Path root;

        @Option(names = {"--prefer-priority"}, description = "Scan priority_jobs before jobs")
        boolean preferPriority;

        @Option(names = {"--loop"}, description = "Keep polling with docqueue.workers threads until stopped")
        boolean loop;

        @Override
        public Integer call() throws InterruptedException {
            Worker worker = new Worker(parent.store(root), new OcrTriageProcessor());
            if (!loop) {
                WorkerOutcome outcome = worker.runOnce(preferPriority);
                parent.out().println(outcome.name().toLowerCase());
                return outcome.getExitCode();
            }

            QueueConfig config = parent.config();
            Scheduler scheduler = new Scheduler(worker, config.getWorkers(),
                    config.getPollIntervalMillis(), preferPriority);
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                scheduler.shutdown();
                stopped.countDown();
            }, "docqueue-shutdown-hook"));
            scheduler.start();
            stopped.await();
            return EXIT_OK;
        }
    }

    @Command(name = "serve", description = "Start the HTTP control plane")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        Main parent;

        @Parameters(index = "0", arity = "0..1", description = "Queue root (default: docqueue.root)")
        Path root;

        @Option(names = {"--port"}, description = "Port (default: docqueue.http.port)")
        Integer port;

        @Option(names = {"--bind"}, description = "Bind address (default: docqueue.http.bind)")
        String bind;

        @Option(names = {"--token"}, description = "Bearer token (default: docqueue.http.token or JOB_QUEUE_TOKEN)")
        String token;

        @Override
        public Integer call() throws IOException, InterruptedException {
            QueueConfig config = parent.config();
            QueueLayout layout = parent.layout(root);
            ControlPlaneServer server = new ControlPlaneServer(
                    new JobStore(layout),
                    new StatsCollector(layout),
                    bind != null ? bind : config.getHttpBind(),
                    port != null ? port : config.getHttpPort(),
                    token != null ? token : config.getHttpToken(),
                    config.getHttpThreads());

            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.stop();
                stopped.countDown();
            }, "docqueue-shutdown-hook"));
            server.start();
            parent.out().println("listening on port " + server.getPort());
            parent.out().flush();
            stopped.await();
            return EXIT_OK;
        }
    }
}
