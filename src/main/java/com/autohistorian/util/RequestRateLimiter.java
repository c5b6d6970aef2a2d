package com.autohistorian.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Minimum-interval rate limiter shared by every caller of one outbound API.
 *
 * <p>Enforces a gap of {@code 60 / requestsPerMinute} seconds between consecutive calls. Callers
 * reserve a departure slot under a single lock: the slot is the later of "now" and the previous
 * slot plus the interval, and the previous-slot watermark moves to the reserved slot before the
 * lock is released. Two concurrent callers therefore never receive the same window.
 *
 * <p>Usage:
 * - Inject one instance per outbound API (generation backend, document source).
 * - Chain {@link #acquire()} in front of the request; it completes when the caller may leave.
 *
 * <p>Notes:
 * - Waiting is a timer, not a parked thread, so no event-loop thread is blocked.
 * - Cancelling the subscriber cancels the wait but keeps the reserved slot consumed.
 * - Single-node only.
 */
public final class RequestRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RequestRateLimiter.class);

    private final Object lock = new Object();
    private final long minIntervalNanos;
    private final LongSupplier nanoClock;
    private final String name;

    private long lastSlotNanos;
    private boolean anySlotIssued;

    public RequestRateLimiter(String name, int requestsPerMinute) {
        this(name, requestsPerMinute, System::nanoTime);
    }

    RequestRateLimiter(String name, int requestsPerMinute, LongSupplier nanoClock) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be positive, got " + requestsPerMinute);
        }
        this.name = name;
        this.minIntervalNanos = TimeUnit.MINUTES.toNanos(1) / requestsPerMinute;
        this.nanoClock = nanoClock;
    }

    /**
     * Reserve the next departure slot and return how long the caller must wait for it.
     */
    public Duration reserve() {
        synchronized (lock) {
            long now = nanoClock.getAsLong();
            long slot = anySlotIssued ? Math.max(now, lastSlotNanos + minIntervalNanos) : now;
            lastSlotNanos = slot;
            anySlotIssued = true;
            return Duration.ofNanos(slot - now);
        }
    }

    /** Completes once this caller's reserved slot has arrived. */
    public Mono<Void> acquire() {
        return Mono.defer(() -> {
            Duration wait = reserve();
            if (wait.isZero()) {
                return Mono.empty();
            }
            log.debug("Rate limiter [{}] delaying call by {} ms", name, wait.toMillis());
            return Mono.delay(wait).then();
        });
    }

    public Duration getMinInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }
}
