package work.lcod.dispatch.convert;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import work.lcod.dispatch.runtime.CommandContext;
import work.lcod.dispatch.shared.Tokenizer;

/**
 * Converters for the built-in {@link ValueType}s.
 */
public final class StandardConverters {
    private StandardConverters() {}

    public static ConverterRegistry register(ConverterRegistry registry) {
        registry.register(new StringConverter());
        registry.register(new StringListConverter());
        registry.register(scalar(ValueType.INTEGER, Integer::valueOf));
        registry.register(scalar(ValueType.LONG, Long::valueOf));
        registry.register(scalar(ValueType.DOUBLE, Double::valueOf));
        registry.register(scalar(ValueType.BOOLEAN, StandardConverters::parseBoolean));
        registry.register(new IntArrayConverter());
        registry.register(new JsonConverter());
        return registry;
    }

    static <T> ValueConverter<T> scalar(ValueType<T> type, Function<String, T> parser) {
        return new ScalarConverter<>(type, parser);
    }

    private static Boolean parseBoolean(String raw) {
        switch (raw.toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "on":
            case "1":
                return Boolean.TRUE;
            case "false":
            case "no":
            case "off":
            case "0":
                return Boolean.FALSE;
            default:
                return null;
        }
    }

    private static final class StringConverter implements ValueConverter<String> {
        @Override
        public ValueType<String> type() {
            return ValueType.STRING;
        }

        @Override
        public String convertFromString(String argument, CommandContext ctx) {
            return argument;
        }

        @Override
        public String convertFromArray(List<String> arguments, CommandContext ctx) {
            return String.join(" ", arguments);
        }
    }

    private static final class StringListConverter implements ValueConverter<List<String>> {
        @Override
        public ValueType<List<String>> type() {
            return ValueType.STRING_LIST;
        }

        @Override
        public List<String> convertFromString(String argument, CommandContext ctx) {
            return argument == null ? null : List.copyOf(Tokenizer.split(argument));
        }

        @Override
        public List<String> convertFromArray(List<String> arguments, CommandContext ctx) {
            return List.copyOf(arguments);
        }
    }

    /**
     * Single-value types. More than one token never converts.
     */
    private static final class ScalarConverter<T> implements ValueConverter<T> {
        private final ValueType<T> type;
        private final Function<String, T> parser;

        private ScalarConverter(ValueType<T> type, Function<String, T> parser) {
            this.type = type;
            this.parser = parser;
        }

        @Override
        public ValueType<T> type() {
            return type;
        }

        @Override
        public T convertFromString(String argument, CommandContext ctx) {
            if (argument == null || argument.isBlank()) {
                return null;
            }
            try {
                return parser.apply(argument.trim());
            } catch (RuntimeException ex) {
                return null;
            }
        }

        @Override
        public T convertFromArray(List<String> arguments, CommandContext ctx) {
            if (arguments.size() != 1) {
                return null;
            }
            return convertFromString(arguments.get(0), ctx);
        }
    }
}
