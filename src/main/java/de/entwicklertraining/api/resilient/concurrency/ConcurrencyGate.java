package de.entwicklertraining.api.resilient.concurrency;

import de.entwicklertraining.api.resilient.ApiClient.InternalException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounds the number of logical requests in flight.
 * <p>
 * Every logical call obtains one {@link Permit} before its first attempt and gives it back
 * when it completes. A gate is either owned by a single {@link de.entwicklertraining.api.resilient.ApiClient}
 * (sized by {@code concurrencyLimit}) or passed to several clients through
 * {@code ApiClientSettings.Builder#sharedGate}, in which case the gate's size governs all of them.
 * <p>
 * Waiting callers are parked on a fair {@link Semaphore}; nothing polls.
 * Releasing a permit is idempotent: a permit only ever returns its slot once, so double
 * releases or stale permits cannot grow the pool beyond its size.
 */
public final class ConcurrencyGate {

    private final int size;
    private final Semaphore semaphore;
    private volatile boolean closed;

    /**
     * Creates a gate admitting at most {@code size} concurrent logical requests.
     *
     * @param size The number of permits, must be at least 1
     * @throws IllegalArgumentException if size is lower than 1
     */
    public ConcurrencyGate(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Concurrency gate size must be >= 1 but was " + size);
        }
        this.size = size;
        this.semaphore = new Semaphore(size, true);
    }

    /**
     * Blocks until a slot is free and returns a permit for it.
     *
     * @return A new permit
     * @throws InternalException if the gate is closed or the thread was interrupted while waiting
     */
    public Permit acquire() {
        ensureOpen();
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InternalException("Interrupted while waiting for a concurrency permit", e);
        }
        return admitted();
    }

    /**
     * Tries to obtain a permit, waiting at most {@code timeout}.
     * Used to re-admit a request that gave up its permit for a long sleep.
     *
     * @param timeout Maximum time to wait
     * @return The permit, or empty if none became free in time
     * @throws InternalException if the gate is closed or the thread was interrupted while waiting
     */
    public Optional<Permit> tryAcquire(Duration timeout) {
        ensureOpen();
        boolean acquired;
        try {
            acquired = semaphore.tryAcquire(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InternalException("Interrupted while re-acquiring a concurrency permit", e);
        }
        return acquired ? Optional.of(admitted()) : Optional.empty();
    }

    /**
     * Returns the permit's slot to this gate. Has no effect if the permit was already released.
     *
     * @param permit The permit to release
     * @throws IllegalArgumentException if the permit was issued by another gate
     */
    public void release(Permit permit) {
        if (permit.gate != this) {
            throw new IllegalArgumentException("Permit was issued by a different concurrency gate");
        }
        permit.release();
    }

    /**
     * Closes the gate. Callers currently waiting and all later callers fail with
     * {@link InternalException}; permits already handed out may still be released.
     */
    public void close() {
        closed = true;
        // wake up waiters so they observe the closed flag
        semaphore.release(size);
    }

    /**
     * @return true once {@link #close()} was called
     */
    public boolean isClosed() {
        return closed;
    }

    /**
     * @return The number of permits this gate was created with
     */
    public int getSize() {
        return size;
    }

    /**
     * A closed gate admits nobody and therefore reports no free slots, even though its
     * semaphore was flooded to wake up waiters.
     *
     * @return The number of currently free slots, between 0 and {@link #getSize()}
     */
    public int availablePermits() {
        return closed ? 0 : semaphore.availablePermits();
    }

    private Permit admitted() {
        if (closed) {
            semaphore.release();
            throw new InternalException("Concurrency gate is closed");
        }
        return new Permit(this);
    }

    private void ensureOpen() {
        if (closed) {
            throw new InternalException("Concurrency gate is closed");
        }
    }

    /**
     * The right to have one logical request in flight.
     */
    public static final class Permit {
        private final ConcurrencyGate gate;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit(ConcurrencyGate gate) {
            this.gate = gate;
        }

        /**
         * Returns the slot to the issuing gate. Only the first call has an effect.
         *
         * @return true if this call released the slot, false if it was already released
         */
        public boolean release() {
            if (released.compareAndSet(false, true)) {
                gate.semaphore.release();
                return true;
            }
            return false;
        }

        /**
         * @return true if the permit was released
         */
        public boolean isReleased() {
            return released.get();
        }
    }
}
