package com.comparo.core.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Request-scoped cancellation flag observed by every target of a comparison.
 * Callbacks registered after cancellation run immediately on the registering thread.
 */
public class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CopyOnWriteArrayList<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * Cancels the signal. Only the first call runs the registered callbacks.
     *
     * @return true if this call performed the cancellation
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable callback : callbacks) {
            runSafely(callback);
        }
        callbacks.clear();
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a callback to run on cancellation.
     *
     * @return a handle that removes the callback
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        // cancel() may have drained the list before the add above
        if (cancelled.get() && callbacks.remove(callback)) {
            runSafely(callback);
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Creates a signal that is cancelled whenever this one is, but can also be cancelled alone.
     */
    public CancellationSignal child() {
        CancellationSignal child = new CancellationSignal();
        onCancel(child::cancel);
        return child;
    }

    /**
     * Handle for removing a cancellation callback.
     */
    @FunctionalInterface
    public interface Registration {
        void unregister();
    }

    private void runSafely(Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }
}
