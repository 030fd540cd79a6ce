package work.lcod.dispatch.convert;

import java.util.List;
import work.lcod.dispatch.runtime.CommandContext;

/**
 * Fallback construction of a value straight from raw tokens, used when no converter is registered
 * for a type.
 */
@FunctionalInterface
public interface TokenFactory<T> {
    T create(List<String> tokens, CommandContext ctx) throws Exception;
}
