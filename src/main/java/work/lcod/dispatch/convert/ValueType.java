package work.lcod.dispatch.convert;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Kind tag for command arguments and results. Two types are the same kind when both their names and Java types match.
 *
 * <p>A type may carry a default value (bound when input runs out of tokens) and a
 * {@link TokenFactory} used when no converter is registered for it.
 */
public final class ValueType<T> {
    public static final ValueType<String> STRING = new ValueType<>("string", String.class, () -> "", null);
    public static final ValueType<Integer> INTEGER = new ValueType<>("integer", Integer.class, () -> 0, null);
    public static final ValueType<Long> LONG = new ValueType<>("long", Long.class, () -> 0L, null);
    public static final ValueType<Double> DOUBLE = new ValueType<>("double", Double.class, () -> 0.0d, null);
    public static final ValueType<Boolean> BOOLEAN = new ValueType<>("boolean", Boolean.class, () -> false, null);
    public static final ValueType<int[]> INT_ARRAY = new ValueType<>("int[]", int[].class, () -> new int[0], null);
    public static final ValueType<List<String>> STRING_LIST = new ValueType<>("string[]", listClass(), List::of, null);
    public static final ValueType<JsonNode> JSON = new ValueType<>("json", JsonNode.class, MissingNode::getInstance, null);
    public static final ValueType<Object> OBJECT = new ValueType<>("object", Object.class, () -> null, null);

    private final String name;
    private final Class<T> javaType;
    private final Supplier<? extends T> defaultValue;
    private final TokenFactory<T> tokenFactory;

    private ValueType(String name, Class<T> javaType, Supplier<? extends T> defaultValue, TokenFactory<T> tokenFactory) {
        this.name = Objects.requireNonNull(name, "name");
        this.javaType = Objects.requireNonNull(javaType, "javaType");
        this.defaultValue = defaultValue == null ? () -> null : defaultValue;
        this.tokenFactory = tokenFactory;
    }

    public static <T> ValueType<T> of(String name, Class<T> javaType) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Type name must not be blank");
        }
        return new ValueType<>(name.trim(), javaType, null, null);
    }

    public ValueType<T> withDefault(Supplier<? extends T> supplier) {
        return new ValueType<>(name, javaType, supplier, tokenFactory);
    }

    public ValueType<T> withFactory(TokenFactory<T> factory) {
        return new ValueType<>(name, javaType, defaultValue, factory);
    }

    public String name() {
        return name;
    }

    public Class<T> javaType() {
        return javaType;
    }

    public T defaultValue() {
        return defaultValue.get();
    }

    public TokenFactory<T> tokenFactory() {
        return tokenFactory;
    }

    public T cast(Object value) {
        if (value == null) {
            return null;
        }
        if (!javaType.isInstance(value)) {
            throw new ClassCastException("Value of " + value.getClass().getName() + " is not a '" + name + "'");
        }
        return javaType.cast(value);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ValueType<?> type && name.equals(type.name) && javaType.equals(type.javaType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, javaType);
    }

    @Override
    public String toString() {
        return name;
    }

    @SuppressWarnings("unchecked")
    private static Class<List<String>> listClass() {
        return (Class<List<String>>) (Class<?>) List.class;
    }
}
