package work.lcod.dispatch.runtime;

import java.util.Objects;
import work.lcod.dispatch.convert.ValueType;

/**
 * Declared handler parameter. {@code repetitions <= 0} consumes every remaining token.
 */
public record ParameterSpec(ValueType<?> type, int repetitions) {
    public ParameterSpec {
        Objects.requireNonNull(type, "type");
    }

    public boolean consumesRemaining() {
        return repetitions <= 0;
    }
}
