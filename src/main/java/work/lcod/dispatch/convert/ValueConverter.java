package work.lcod.dispatch.convert;

import java.util.List;
import work.lcod.dispatch.runtime.CommandContext;

/**
 * Turns raw tokens into a value of {@link #type()}. Conversion failure is signalled by returning
 * {@code null}; implementations do not throw.
 */
public interface ValueConverter<T> {
    ValueType<T> type();

    T convertFromString(String argument, CommandContext ctx);

    T convertFromArray(List<String> arguments, CommandContext ctx);
}
