package work.lcod.dispatch.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import work.lcod.dispatch.alias.AliasMatcher;
import work.lcod.dispatch.alias.AliasPattern;
import work.lcod.dispatch.convert.ValueType;

/**
 * Fluent registration of a command. A command without explicit aliases answers to its name.
 *
 * <pre>{@code
 * CommandMetadata echo = CommandDefinition.command("echo")
 *     .remaining(ValueType.STRING)
 *     .returns(ValueType.STRING)
 *     .handler((ctx, args) -> args.get(0, ValueType.STRING))
 *     .build();
 * }</pre>
 */
public final class CommandDefinition {
    private final String name;
    private final List<AliasMatcher> aliases = new ArrayList<>();
    private final List<ParameterSpec> parameters = new ArrayList<>();
    private final List<ExecutorData> subcommands = new ArrayList<>();
    private Supplier<? extends CommandHandler> handlerFactory;
    private ValueType<?> returnType = ValueType.OBJECT;
    private boolean async;

    private CommandDefinition(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Command name must not be blank");
        }
        this.name = name.trim();
    }

    public static CommandDefinition command(String name) {
        return new CommandDefinition(name);
    }

    public CommandDefinition alias(String alias) {
        return alias(AliasPattern.of(alias));
    }

    public CommandDefinition alias(AliasMatcher matcher) {
        aliases.add(Objects.requireNonNull(matcher, "matcher"));
        return this;
    }

    /** One token. */
    public CommandDefinition parameter(ValueType<?> type) {
        return parameter(type, 1);
    }

    public CommandDefinition parameter(ValueType<?> type, int repetitions) {
        parameters.add(new ParameterSpec(type, repetitions));
        return this;
    }

    /** Every token left after the preceding parameters. */
    public CommandDefinition remaining(ValueType<?> type) {
        return parameter(type, 0);
    }

    public CommandDefinition returns(ValueType<?> type) {
        this.returnType = Objects.requireNonNull(type, "type");
        return this;
    }

    public CommandDefinition async() {
        this.async = true;
        return this;
    }

    public CommandDefinition subcommand(CommandDefinition subcommand) {
        subcommands.add(subcommand.buildExecutor());
        return this;
    }

    public CommandDefinition handler(CommandHandler handler) {
        Objects.requireNonNull(handler, "handler");
        this.handlerFactory = () -> handler;
        return this;
    }

    /**
     * Registers a factory invoked once per invocation, for handlers that keep per-call state.
     */
    public CommandDefinition handlerFactory(Supplier<? extends CommandHandler> factory) {
        this.handlerFactory = Objects.requireNonNull(factory, "factory");
        return this;
    }

    public ExecutorData buildExecutor() {
        if (handlerFactory == null) {
            throw new IllegalStateException("Command '" + name + "' has no handler");
        }
        AliasMatcher matcher = aliases.isEmpty() ? AliasPattern.of(name) : aliases.get(0);
        return new ExecutorData(name, matcher, handlerFactory, async, subcommands, parameters, returnType);
    }

    public CommandMetadata build() {
        var executor = buildExecutor();
        List<AliasMatcher> selectors = aliases.isEmpty() ? List.of(executor.matcher()) : aliases;
        return new CommandMetadata(selectors, executor);
    }
}
