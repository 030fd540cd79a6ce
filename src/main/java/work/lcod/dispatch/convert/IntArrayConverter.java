package work.lcod.dispatch.convert;

import java.util.List;
import work.lcod.dispatch.runtime.CommandContext;
import work.lcod.dispatch.shared.Tokenizer;

/**
 * Converts tokens to an {@code int[]}. A single token is split on whitespace first, so a forwarded
 * {@code "1 2 3"} becomes three elements.
 */
public final class IntArrayConverter implements ValueConverter<int[]> {
    @Override
    public ValueType<int[]> type() {
        return ValueType.INT_ARRAY;
    }

    @Override
    public int[] convertFromString(String argument, CommandContext ctx) {
        if (argument == null) {
            return null;
        }
        return convertFromArray(Tokenizer.split(argument), ctx);
    }

    @Override
    public int[] convertFromArray(List<String> arguments, CommandContext ctx) {
        int[] array = new int[arguments.size()];
        for (int i = 0; i < arguments.size(); i++) {
            try {
                array[i] = Integer.parseInt(arguments.get(i).trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return array;
    }
}
