package work.lcod.dispatch.runtime;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.dispatch.api.InputResult;
import work.lcod.dispatch.api.ResultCallback;
import work.lcod.dispatch.convert.ConverterRegistry;
import work.lcod.dispatch.convert.TypedValue;

/**
 * Runs the stages of a piped line one after another. A stage is only resolved and scheduled once
 * the previous stage's completion handle has completed, and it receives the previous result as one
 * extra trailing argument.
 *
 * <p>The pipeline reports once: the last stage's outcome, {@code UNHANDLED} for the first stage that
 * matches no command, or {@code FAILURE} for the first intermediate stage that fails. Side effects
 * of completed stages are kept.
 */
final class PipelineExecution {
    private static final Logger LOG = LoggerFactory.getLogger(PipelineExecution.class);

    private final MetadataCatalog catalog;
    private final ConverterRegistry registry;
    private final Executor executor;
    private final List<String> stages;
    private final CommandContext context;
    private final ResultCallback callback;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    PipelineExecution(
        MetadataCatalog catalog,
        ConverterRegistry registry,
        Executor executor,
        List<String> stages,
        CommandContext context,
        ResultCallback callback
    ) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.stages = List.copyOf(stages);
        this.context = context;
        this.callback = OnceResultCallback.wrap(callback);
        if (this.stages.isEmpty()) {
            throw new IllegalArgumentException("A pipeline needs at least one stage");
        }
    }

    /**
     * Starts the first stage and returns a handle completing after the pipeline reported.
     */
    CompletableFuture<Void> start() {
        runStage(0, null);
        return completion;
    }

    private void runStage(int index, TypedValue forwarded) {
        try {
            String stageInput = stages.get(index).trim();
            var resolution = catalog.resolveFirst(stageInput);
            if (resolution.isEmpty()) {
                LOG.debug("Pipeline stage {} '{}' matched no command; aborting", index, stageInput);
                finish(InputResult.UNHANDLED, null);
                return;
            }
            boolean last = index == stages.size() - 1;
            List<TypedValue> extra = forwarded == null ? List.of() : List.of(forwarded);
            var binder = new ArgumentBinder(
                registry,
                resolution.get().metadata().executor(),
                resolution.get().arguments(stageInput),
                extra,
                context
            );
            var execution = new CommandExecution(binder, last ? callback : null);
            execution.start(executor).whenComplete((completed, error) -> {
                if (error != null) {
                    finish(InputResult.FAILURE, unwrap(error));
                } else if (last) {
                    completion.complete(null);
                } else if (completed.outcome() == InputResult.FAILURE) {
                    LOG.debug("Pipeline stage {} failed; skipping {} remaining stage(s)", index, stages.size() - index - 1);
                    finish(InputResult.FAILURE, completed.output());
                } else {
                    runStage(index + 1, completed.forwardedOutput());
                }
            });
        } catch (RuntimeException ex) {
            finish(InputResult.FAILURE, ex);
        }
    }

    private void finish(InputResult result, Object payload) {
        callback.onResult(result, payload);
        completion.complete(null);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
