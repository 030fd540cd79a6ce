package work.lcod.dispatch.runtime;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.dispatch.api.DispatchConfiguration;
import work.lcod.dispatch.api.InputResult;
import work.lcod.dispatch.api.ResultCallback;
import work.lcod.dispatch.convert.ConverterRegistry;

/**
 * Process-wide entry point: stores command metadata, queues submitted lines and dispatches them
 * from a single background worker thread.
 *
 * <p>Lines are dequeued in submission order. A line without the pipe delimiter runs as one command;
 * a piped line runs as a {@link PipelineExecution}. Either way the worker hands the work to the
 * execution pool and moves on, so independent commands complete in any order.
 *
 * <p>{@link #stop()} stops intake; lines still queued are abandoned without a callback and
 * commands already running finish and report normally. A stopped queue cannot be restarted.
 */
public final class CommandQueue implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CommandQueue.class);

    private final ConverterRegistry registry;
    private final DispatchConfiguration configuration;
    private final MetadataCatalog catalog = new MetadataCatalog();
    private final BlockingQueue<SubmittedCommand> queue = new LinkedBlockingQueue<>();
    private final CancellationToken cancellation = new CancellationToken();
    private final AtomicBoolean started = new AtomicBoolean();
    private final Pattern pipeSplitter;
    private final ExecutorService executions;
    private volatile Thread worker;
    private volatile boolean closed;

    public CommandQueue(ConverterRegistry registry) {
        this(registry, DispatchConfiguration.defaults());
    }

    public CommandQueue(ConverterRegistry registry, DispatchConfiguration configuration) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.pipeSplitter = Pattern.compile(Pattern.quote(String.valueOf(configuration.pipeDelimiter())));
        this.executions = Executors.newFixedThreadPool(
            configuration.workerThreads(),
            new NamedThreadFactory(configuration.threadName() + "-exec")
        );
    }

    /**
     * Adds command metadata. Safe to call while lines are being processed; lines already being
     * resolved keep the snapshot they started with.
     */
    public void registerMetadata(CommandMetadata metadata) {
        ensureNotClosed();
        catalog.register(metadata);
    }

    public List<CommandMetadata> metadata() {
        return catalog.snapshot();
    }

    /**
     * Starts the worker thread.
     *
     * @throws IllegalStateException if the queue was already started or has been stopped
     */
    public void start() {
        ensureNotClosed();
        if (cancellation.isCancelled()) {
            throw new IllegalStateException("The CommandQueue has been stopped and cannot be restarted.");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("The CommandQueue has already been started.");
        }
        var thread = new Thread(this::processLoop, configuration.threadName());
        thread.setDaemon(true);
        worker = thread;
        thread.start();
        LOG.info("Command queue '{}' started ({} execution threads)", configuration.threadName(), configuration.workerThreads());
    }

    /**
     * Queues a line for dispatch and returns immediately.
     *
     * @throws IllegalStateException once the queue has been stopped
     */
    public void submit(String input, CommandContext context, ResultCallback callback) {
        Objects.requireNonNull(callback, "callback");
        if (closed || cancellation.isCancelled()) {
            throw new IllegalStateException("The CommandQueue has been stopped; input is no longer accepted.");
        }
        queue.add(new SubmittedCommand(input, context, OnceResultCallback.wrap(callback)));
    }

    /**
     * Stops accepting input. The worker notices within one poll interval and exits; it is never
     * interrupted, so a callback running on it finishes normally. Idempotent; does not wait for
     * running commands.
     */
    public void stop() {
        cancellation.cancel();
    }

    /**
     * Stops the queue and shuts the execution pool down. Commands already scheduled still run;
     * pipeline stages that were not yet scheduled report {@code FAILURE}.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        stop();
        closed = true;
        executions.shutdown();
    }

    /**
     * Waits for scheduled commands to finish after {@link #close()}.
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return executions.awaitTermination(timeout, unit);
    }

    public boolean isRunning() {
        var thread = worker;
        return thread != null && thread.isAlive();
    }

    int pending() {
        return queue.size();
    }

    private void processLoop() {
        long pollMillis = configuration.pollInterval().toMillis();
        while (!cancellation.isCancelled()) {
            SubmittedCommand next;
            try {
                next = queue.poll(pollMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                LOG.warn("Command queue '{}' worker interrupted; stopping", configuration.threadName());
                cancellation.cancel();
                break;
            }
            if (next == null) {
                continue;
            }
            try {
                dispatch(next);
            } catch (RuntimeException ex) {
                LOG.warn("Failed to dispatch '{}'", next.rawInput(), ex);
                next.callback().onResult(InputResult.FAILURE, ex);
            }
        }
        int abandoned = queue.size();
        if (abandoned > 0) {
            LOG.info("Command queue '{}' stopped; abandoning {} queued input(s)", configuration.threadName(), abandoned);
        } else {
            LOG.info("Command queue '{}' stopped", configuration.threadName());
        }
    }

    private void dispatch(SubmittedCommand command) {
        String input = command.rawInput();
        if (input == null) {
            command.callback().onResult(
                InputResult.FAILURE,
                new CommandParsingException(ParserFailReason.INVALID_ARGUMENTS, "Null was provided as input.")
            );
            return;
        }

        String[] segments = pipeSplitter.split(input, -1);
        if (segments.length > 1) {
            LOG.debug("Dispatching {}-stage pipeline '{}'", segments.length, input);
            new PipelineExecution(catalog, registry, executions, Arrays.asList(segments), command.context(), command.callback())
                .start();
            return;
        }

        String line = input.trim();
        var resolution = catalog.resolveFirst(line);
        if (resolution.isEmpty()) {
            LOG.debug("No command matches '{}'", line);
            command.callback().onResult(InputResult.UNHANDLED, null);
            return;
        }

        var metadata = resolution.get().metadata();
        LOG.debug("Dispatching '{}' to command '{}'", line, metadata.name());
        var binder = new ArgumentBinder(registry, metadata.executor(), resolution.get().arguments(line), List.of(), command.context());
        try {
            new CommandExecution(binder, command.callback()).start(executions).whenComplete((done, error) -> {
                if (error != null) {
                    command.callback().onResult(InputResult.FAILURE, unwrap(error));
                }
            });
        } catch (RejectedExecutionException ex) {
            command.callback().onResult(InputResult.FAILURE, new IllegalStateException("The CommandQueue has been closed.", ex));
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("The CommandQueue has been closed.");
        }
    }

    /**
     * Cooperative stop flag checked once per worker iteration.
     */
    static final class CancellationToken {
        private volatile boolean cancelled = false;

        void cancel() {
            this.cancelled = true;
        }

        boolean isCancelled() {
            return cancelled;
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable task) {
            var thread = new Thread(task, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
