package work.lcod.dispatch.api;

import java.util.Locale;

/**
 * Outcome reported to a {@link ResultCallback} once a submitted line has been handled.
 */
public enum InputResult {
    SUCCESS,
    FAILURE,
    UNHANDLED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
