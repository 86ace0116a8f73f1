package com.questrail.arena.ingest.resolve;

import com.questrail.arena.ingest.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * RemoteCallGate
 * -----------------------------------------------------------------------------
 * Enforces a minimum spacing between remote calls, measured on a
 * {@link MonotonicClock}.
 *
 * <p>Each caller reserves the next free slot under a lock and then waits
 * outside it, so the lock only orders the timing of remote calls; cache and
 * catalog lookups for other ids never queue behind it.</p>
 */
final class RemoteCallGate {

    /** Blocks the calling thread; replaced in tests. */
    @FunctionalInterface
    interface Sleeper {
        void sleepNanos(long nanos) throws InterruptedException;
    }

    static final Sleeper THREAD_SLEEPER = TimeUnit.NANOSECONDS::sleep;

    private final MonotonicClock clock;
    private final long minIntervalNanos;
    private final Sleeper sleeper;

    private final Object lock = new Object();
    private long nextSlotNanos;
    private boolean used;

    RemoteCallGate(MonotonicClock clock, Duration minInterval, Sleeper sleeper) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.minIntervalNanos = Objects.requireNonNull(minInterval, "minInterval").toNanos();
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Waits until this caller's slot arrives.
     *
     * @return nanoseconds waited (0 if the slot was already open)
     */
    long acquire() throws InterruptedException {
        long waitNanos;
        synchronized (lock) {
            long now = clock.nowNanos();
            long slot = used ? Math.max(now, nextSlotNanos) : now;
            used = true;
            nextSlotNanos = slot + minIntervalNanos;
            waitNanos = slot - now;
        }
        if (waitNanos > 0) {
            sleeper.sleepNanos(waitNanos);
        }
        return waitNanos;
    }
}
