package work.lcod.dispatch.convert;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A token or a forwarded stage result, tagged with its {@link ValueType}.
 */
public record TypedValue(ValueType<?> type, Object value) {
    public TypedValue {
        Objects.requireNonNull(type, "type");
    }

    public static TypedValue text(String token) {
        return new TypedValue(ValueType.STRING, token);
    }

    public boolean isKind(ValueType<?> other) {
        return type.equals(other);
    }

    /**
     * Textual form handed to converters. Arrays and collections render as space-separated items.
     */
    public String text() {
        if (value == null) {
            return "";
        }
        if (value instanceof String str) {
            return str;
        }
        if (value instanceof int[] ints) {
            return Arrays.stream(ints).mapToObj(String::valueOf).collect(Collectors.joining(" "));
        }
        if (value instanceof Object[] items) {
            return Arrays.stream(items).map(String::valueOf).collect(Collectors.joining(" "));
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(String::valueOf).collect(Collectors.joining(" "));
        }
        return String.valueOf(value);
    }
}
