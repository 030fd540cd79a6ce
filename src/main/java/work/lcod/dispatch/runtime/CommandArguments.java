package work.lcod.dispatch.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import work.lcod.dispatch.convert.ValueType;

/**
 * Bound parameter values in declaration order.
 */
public final class CommandArguments {
    private final List<Object> values;

    public CommandArguments(List<Object> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public <T> T get(int index, ValueType<T> type) {
        if (index < 0 || index >= values.size()) {
            throw new IndexOutOfBoundsException("No argument at index " + index + " (bound " + values.size() + ")");
        }
        return type.cast(values.get(index));
    }

    public Object get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    public List<Object> asList() {
        return values;
    }
}
