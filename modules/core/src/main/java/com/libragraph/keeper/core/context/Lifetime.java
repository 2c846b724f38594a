package com.libragraph.keeper.core.context;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation signal shared top-down through a supervision run.
 *
 * <p>Cancelling a lifetime cancels every {@link #child()} created from it; cancelling
 * a child never affects its parent. Cancellation is one-way and idempotent.
 */
public final class Lifetime {

    private static final Logger log = Logger.getLogger(Lifetime.class);

    private final CountDownLatch done = new CountDownLatch(1);
    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled;

    private Lifetime() {
    }

    public static Lifetime create() {
        return new Lifetime();
    }

    /** Returns a lifetime that ends when this one does, or earlier when cancelled itself. */
    public Lifetime child() {
        Lifetime child = new Lifetime();
        Runnable cancelChild = child::cancel;
        onCancel(cancelChild);
        child.onCancel(() -> removeCallback(cancelChild));
        return child;
    }

    /**
     * Cancels this lifetime and runs the registered callbacks on the calling thread.
     *
     * @return false if it was already cancelled
     */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized (callbacks) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        done.countDown();
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed", e);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return done.getCount() == 0;
    }

    /** Runs {@code callback} on cancellation, immediately if already cancelled. */
    public void onCancel(Runnable callback) {
        synchronized (callbacks) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        callback.run();
    }

    private void removeCallback(Runnable callback) {
        synchronized (callbacks) {
            callbacks.remove(callback);
        }
    }

    int pendingCallbacks() {
        synchronized (callbacks) {
            return callbacks.size();
        }
    }

    /** Blocks until cancelled. */
    public void await() throws InterruptedException {
        done.await();
    }

    /**
     * Blocks until cancelled or until {@code timeout} elapses.
     *
     * @return true if cancelled
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return done.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw cancellation();
        }
    }

    /** The error a service returns from {@code run} to report a clean stop. */
    public static CancellationException cancellation() {
        return new CancellationException("context canceled");
    }
}
