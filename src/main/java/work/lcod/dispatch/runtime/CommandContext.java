package work.lcod.dispatch.runtime;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Caller-supplied capability bag handed to every handler and converter of a submitted line. The
 * dispatcher never inspects it.
 */
public class CommandContext {
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    public static CommandContext empty() {
        return new CommandContext();
    }

    public static CommandContext of(Map<String, ?> attributes) {
        var ctx = new CommandContext();
        if (attributes != null) {
            attributes.forEach(ctx::setAttribute);
        }
        return ctx;
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public <T> T getAttribute(String key, Class<T> type) {
        Object value = attributes.get(key);
        return type.isInstance(value) ? type.cast(value) : null;
    }

    public void setAttribute(String key, Object value) {
        if (value == null) {
            attributes.remove(key);
        } else {
            attributes.put(key, value);
        }
    }
}
