package fr.lapetina.aitranslation.fanout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned signal that aborts a translation in flight.
 *
 * Callbacks registered after cancellation run immediately on the registering thread.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * A fresh token nobody will cancel.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            // Whoever removes a callback runs it, so each callback runs once.
            for (Runnable callback : callbacks) {
                if (callbacks.remove(callback)) {
                    run(callback);
                }
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            run(callback);
        }
    }

    public void removeCallback(Runnable callback) {
        callbacks.remove(callback);
    }

    private static void run(Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            log.error("Error running cancellation callback", e);
        }
    }
}
