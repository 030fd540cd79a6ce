package work.lcod.dispatch.runtime;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import work.lcod.dispatch.alias.AliasMatcher;
import work.lcod.dispatch.convert.ValueType;

/**
 * Everything needed to bind and run one command or subcommand: a handler factory, its parameters,
 * its return type, and nested subcommands. Built by {@link CommandDefinition}.
 */
public final class ExecutorData {
    private final String name;
    private final AliasMatcher matcher;
    private final Supplier<? extends CommandHandler> handlerFactory;
    private final boolean async;
    private final List<ExecutorData> subcommands;
    private final List<ParameterSpec> parameters;
    private final ValueType<?> returnType;

    ExecutorData(
        String name,
        AliasMatcher matcher,
        Supplier<? extends CommandHandler> handlerFactory,
        boolean async,
        List<ExecutorData> subcommands,
        List<ParameterSpec> parameters,
        ValueType<?> returnType
    ) {
        this.name = Objects.requireNonNull(name, "name");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.handlerFactory = Objects.requireNonNull(handlerFactory, "handlerFactory");
        this.async = async;
        this.subcommands = subcommands == null ? List.of() : List.copyOf(subcommands);
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.returnType = returnType == null ? ValueType.OBJECT : returnType;
    }

    public String name() {
        return name;
    }

    public AliasMatcher matcher() {
        return matcher;
    }

    public boolean async() {
        return async;
    }

    public boolean hasSubcommands() {
        return !subcommands.isEmpty();
    }

    public List<ExecutorData> subcommands() {
        return subcommands;
    }

    public List<ParameterSpec> parameters() {
        return parameters;
    }

    public ValueType<?> returnType() {
        return returnType;
    }

    /**
     * A fresh handler for one invocation. Handlers are never reused across invocations.
     */
    public CommandHandler newHandler() {
        CommandHandler handler = handlerFactory.get();
        if (handler == null) {
            throw new IllegalStateException("Handler factory for '" + name + "' returned null");
        }
        return handler;
    }
}
