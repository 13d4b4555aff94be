package enricher.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot, broadcast stop request shared by every component of a run.
 *
 * <p>{@link #cancel(String)} is idempotent: only the first call flips the state
 * and notifies listeners. Listeners registered after the signal fired run
 * immediately on the registering thread. Listeners must not block.</p>
 */
public final class ShutdownSignal {

    private static final Logger log = LoggerFactory.getLogger(ShutdownSignal.class);

    private final CopyOnWriteArrayList<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final CountDownLatch fired = new CountDownLatch(1);
    private volatile String reason;

    /** Handle returned by {@link #onCancel(Runnable)}; closing it removes the listener. */
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * Fire the signal.
     *
     * @param reason short human-readable cause (e.g. "interrupt", "test")
     * @return true if this call fired the signal, false if it was already fired
     */
    public boolean cancel(String reason) {
        List<Runnable> toNotify;
        synchronized (this) {
            if (this.reason != null) {
                return false;
            }
            this.reason = reason == null ? "cancelled" : reason;
            toNotify = List.copyOf(listeners);
            listeners.clear();
        }
        fired.countDown();
        log.info("Shutdown requested: {}", this.reason);

        for (Runnable r : toNotify) {
            try {
                r.run();
            } catch (RuntimeException e) {
                log.warn("Shutdown listener failed: {}", e.getMessage(), e);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return reason != null;
    }

    /** Why the signal fired, or null if it has not. */
    public String reason() {
        return reason;
    }

    /**
     * Register a callback to run when the signal fires.
     */
    public Registration onCancel(Runnable listener) {
        synchronized (this) {
            if (reason == null) {
                listeners.add(listener);
                return () -> listeners.remove(listener);
            }
        }
        listener.run();
        return () -> {
        };
    }

    /**
     * Wait for the signal to fire.
     *
     * @return true if it fired within the timeout
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return fired.await(timeout, unit);
    }
}
