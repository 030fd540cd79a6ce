package work.lcod.dispatch.runtime;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.dispatch.api.InputResult;
import work.lcod.dispatch.api.ResultCallback;

/**
 * Forwards the first outcome to the wrapped callback and drops any later one.
 */
final class OnceResultCallback implements ResultCallback {
    private static final Logger LOG = LoggerFactory.getLogger(OnceResultCallback.class);

    private final ResultCallback delegate;
    private final AtomicBoolean delivered = new AtomicBoolean();

    private OnceResultCallback(ResultCallback delegate) {
        this.delegate = delegate;
    }

    static OnceResultCallback wrap(ResultCallback callback) {
        Objects.requireNonNull(callback, "callback");
        return callback instanceof OnceResultCallback once ? once : new OnceResultCallback(callback);
    }

    @Override
    public void onResult(InputResult result, Object payload) {
        if (!delivered.compareAndSet(false, true)) {
            LOG.debug("Dropping duplicate {} outcome", result);
            return;
        }
        try {
            delegate.onResult(result, payload);
        } catch (RuntimeException ex) {
            LOG.warn("Result callback threw while handling {} outcome", result, ex);
        }
    }
}
