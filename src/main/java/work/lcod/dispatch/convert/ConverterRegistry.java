package work.lcod.dispatch.convert;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import work.lcod.dispatch.runtime.CommandContext;
import work.lcod.dispatch.runtime.CommandParsingException;
import work.lcod.dispatch.runtime.ParserFailReason;

/**
 * Stores value converters and the fallback builders used when a type has none.
 */
public final class ConverterRegistry {
    private final Map<ValueType<?>, ValueConverter<?>> converters = new ConcurrentHashMap<>();

    /**
     * Registry preloaded with the converters from {@link StandardConverters}.
     */
    public static ConverterRegistry withDefaults() {
        var registry = new ConverterRegistry();
        StandardConverters.register(registry);
        return registry;
    }

    public <T> ConverterRegistry register(ValueConverter<T> converter) {
        converters.put(converter.type(), converter);
        return this;
    }

    @SuppressWarnings("unchecked")
    public <T> ValueConverter<T> getConverter(ValueType<T> type) {
        return (ValueConverter<T>) converters.get(type);
    }

    public <T> T constructDefault(ValueType<T> type) {
        return type.defaultValue();
    }

    public <T> T constructFromTokens(ValueType<T> type, List<String> tokens, CommandContext ctx) {
        TokenFactory<T> factory = type.tokenFactory();
        if (factory == null) {
            throw new CommandParsingException(
                ParserFailReason.PARSING_FAILED,
                "No converter or factory is registered for type '" + type.name() + "'.",
                tokens,
                type,
                null
            );
        }
        T value;
        try {
            value = factory.create(tokens, ctx);
        } catch (CommandParsingException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new CommandParsingException(
                ParserFailReason.PARSING_FAILED,
                "Failed to construct type '" + type.name() + "' from '" + String.join(" ", tokens) + "'.",
                tokens,
                type,
                ex
            );
        }
        if (value == null) {
            throw new CommandParsingException(
                ParserFailReason.PARSING_FAILED,
                "Factory for type '" + type.name() + "' produced no value from '" + String.join(" ", tokens) + "'.",
                tokens,
                type,
                null
            );
        }
        return value;
    }
}
