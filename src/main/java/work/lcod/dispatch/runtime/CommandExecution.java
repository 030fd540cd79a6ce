package work.lcod.dispatch.runtime;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.dispatch.api.InputResult;
import work.lcod.dispatch.api.ResultCallback;
import work.lcod.dispatch.convert.TypedValue;

/**
 * One binder run as a schedulable unit with its own output slot. Reports through its callback,
 * when it has one, exactly once.
 */
public final class CommandExecution {
    private static final Logger LOG = LoggerFactory.getLogger(CommandExecution.class);

    private final ArgumentBinder binder;
    private final ResultCallback callback;
    private volatile InputResult outcome;
    private volatile Object output;

    public CommandExecution(ArgumentBinder binder, ResultCallback callback) {
        this.binder = Objects.requireNonNull(binder, "binder");
        this.callback = callback;
    }

    /**
     * Schedules {@link #run()} on {@code executor}. The returned handle completes with this execution
     * once it has finished and reported.
     */
    public CompletableFuture<CommandExecution> start(Executor executor) {
        return CompletableFuture.runAsync(this::run, executor).thenApply(ignored -> this);
    }

    public void run() {
        InputResult result;
        Object value;
        try {
            value = binder.run();
            result = InputResult.SUCCESS;
        } catch (Exception ex) {
            LOG.debug("Command '{}' failed", binder.activeExecutor().name(), ex);
            value = ex;
            result = InputResult.FAILURE;
        }
        output = value;
        outcome = result;
        if (callback != null) {
            callback.onResult(result, value);
        }
    }

    public InputResult outcome() {
        return outcome;
    }

    public Object output() {
        return output;
    }

    /**
     * The successful result tagged with the executor's declared return type, or {@code null} when
     * there is nothing to forward.
     */
    public TypedValue forwardedOutput() {
        if (outcome != InputResult.SUCCESS || output == null) {
            return null;
        }
        return new TypedValue(binder.activeExecutor().returnType(), output);
    }
}
