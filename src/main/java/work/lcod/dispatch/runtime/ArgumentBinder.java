package work.lcod.dispatch.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import work.lcod.dispatch.convert.ConverterRegistry;
import work.lcod.dispatch.convert.TypedValue;
import work.lcod.dispatch.convert.ValueConverter;
import work.lcod.dispatch.convert.ValueType;
import work.lcod.dispatch.shared.Tokenizer;

/**
 * Binds argument text to a command's parameters and invokes its handler. One binder serves exactly
 * one invocation and is only touched by the thread running it.
 */
public final class ArgumentBinder {
    private final ConverterRegistry registry;
    private final CommandContext context;
    private final List<TypedValue> extraArguments;
    private final List<Object> boundArguments = new ArrayList<>();
    private ExecutorData executor;
    private String input;

    public ArgumentBinder(
        ConverterRegistry registry,
        ExecutorData executor,
        String input,
        List<TypedValue> extraArguments,
        CommandContext context
    ) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.input = input;
        this.extraArguments = extraArguments == null ? List.of() : List.copyOf(extraArguments);
        this.context = context;
    }

    /**
     * Runs every binding step and the handler, returning the handler's (awaited) result.
     */
    public Object run() {
        checkBasicArgumentRules();
        attemptSwitchToSubcommand();
        convertArgumentsToTypes();
        return invoke();
    }

    /**
     * The executor that ran, which is a subcommand's once one was selected.
     */
    public ExecutorData activeExecutor() {
        return executor;
    }

    List<Object> boundArguments() {
        return List.copyOf(boundArguments);
    }

    private void checkBasicArgumentRules() {
        if (input == null) {
            throw new CommandParsingException(ParserFailReason.INVALID_ARGUMENTS, "Null was provided as arguments.");
        }
    }

    private void attemptSwitchToSubcommand() {
        if (!executor.hasSubcommands() || input.isEmpty()) {
            return;
        }
        for (ExecutorData subcommand : executor.subcommands()) {
            if (subcommand.matcher().matches(input)) {
                executor = subcommand;
                input = subcommand.matcher().removeMatched(input);
                return;
            }
        }
    }

    private void convertArgumentsToTypes() {
        var tokens = new ArrayList<TypedValue>();
        for (String token : Tokenizer.split(input)) {
            tokens.add(TypedValue.text(token));
        }
        tokens.addAll(extraArguments);

        int cursor = 0;
        for (ParameterSpec spec : executor.parameters()) {
            int width = spec.consumesRemaining() ? tokens.size() - cursor : spec.repetitions();
            if (cursor >= tokens.size()) {
                // Missing trailing arguments bind to the type's default.
                boundArguments.add(registry.constructDefault(spec.type()));
                continue;
            }
            int end = width > tokens.size() - cursor ? tokens.size() : cursor + width;
            var slot = tokens.subList(cursor, end);
            boundArguments.add(convertSlot(spec.type(), slot, width));
            cursor = end == tokens.size() ? end : cursor + width;
        }
    }

    private Object convertSlot(ValueType<?> type, List<TypedValue> slot, int width) {
        if (width == 1 && slot.get(0).isKind(type)) {
            return slot.get(0).value();
        }
        var texts = new ArrayList<String>(slot.size());
        for (TypedValue value : slot) {
            texts.add(value.text());
        }
        ValueConverter<?> converter = registry.getConverter(type);
        if (converter == null) {
            return registry.constructFromTokens(type, texts, context);
        }
        Object conversion = width > 1
            ? converter.convertFromArray(texts, context)
            : converter.convertFromString(texts.get(0), context);
        if (conversion == null) {
            throw new CommandParsingException(
                ParserFailReason.PARSING_FAILED,
                "Type conversion failed: Failed to convert '" + String.join(" ", texts) + "' to type '" + type.name() + "'.",
                texts,
                type,
                new IllegalArgumentException("Conversion failed in '" + converter.getClass().getSimpleName() + "'")
            );
        }
        return conversion;
    }

    private Object invoke() {
        CommandHandler handler = executor.newHandler();
        Object result;
        try {
            result = handler.invoke(context, new CommandArguments(boundArguments));
        } catch (Exception ex) {
            throw new CommandHandlerException(executor.name(), ex);
        }
        if (!executor.async()) {
            return result;
        }
        if (!(result instanceof CompletionStage<?> stage)) {
            throw new CommandHandlerException(executor.name(), "asynchronous handler did not return a CompletionStage");
        }
        try {
            return stage.toCompletableFuture().get();
        } catch (ExecutionException ex) {
            throw new CommandHandlerException(executor.name(), ex.getCause() == null ? ex : ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CommandHandlerException(executor.name(), ex);
        }
    }
}
