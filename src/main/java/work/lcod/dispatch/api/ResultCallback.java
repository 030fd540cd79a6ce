package work.lcod.dispatch.api;

/**
 * Receives the outcome of a submitted command line. Invoked exactly once per line.
 *
 * <p>The payload is the handler's return value on {@link InputResult#SUCCESS}, the error on
 * {@link InputResult#FAILURE}, and {@code null} on {@link InputResult#UNHANDLED}.
 */
@FunctionalInterface
public interface ResultCallback {
    void onResult(InputResult result, Object payload);
}
