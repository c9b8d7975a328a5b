package com.episcope.trends.service.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Global gate in front of the upstream source.
 *
 * One instance is shared by every caller. A batch takes the single upstream slot,
 * pays {@code baseDelay} once, and keeps the slot for its sequential upstream calls,
 * so overlapping batches for different entities queue up here while their cache reads
 * proceed in parallel.
 */
@Slf4j
public class RateLimiter {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Duration interKindDelay;
    private final Sleeper sleeper;
    private final Semaphore upstreamSlot = new Semaphore(1, true);

    public RateLimiter(Duration baseDelay, Duration maxDelay, Duration interKindDelay, Sleeper sleeper) {
        if (interKindDelay.compareTo(baseDelay) >= 0) {
            throw new IllegalArgumentException("Inter-kind delay " + interKindDelay
                    + " must be smaller than the base delay " + baseDelay);
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.interKindDelay = interKindDelay;
        this.sleeper = sleeper;
    }

    /**
     * Acquire the upstream slot, then wait the base delay before the first call.
     *
     * @param timeout time left to the caller, null to wait indefinitely
     * @return the held slot; close it once the batch is done with upstream
     * @throws TimeoutException when the slot could not be acquired in time, or the base
     *         delay would outlast the time left once it was
     */
    public Slot waitForSlot(Duration timeout) throws InterruptedException, TimeoutException {
        if (timeout == null) {
            upstreamSlot.acquire();
        } else if (!upstreamSlot.tryAcquire(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS)) {
            throw new TimeoutException("Timed out after " + timeout + " waiting for the upstream slot");
        }

        Slot slot = new Slot();
        if (timeout != null && baseDelay.compareTo(timeout) > 0) {
            slot.close();
            throw new TimeoutException("Base delay " + baseDelay + " exceeds the remaining " + timeout);
        }
        try {
            log.info("Rate limiting: sleeping for {}s before upstream request", baseDelay.toSeconds());
            sleeper.sleep(baseDelay);
        } catch (InterruptedException e) {
            slot.close();
            throw e;
        }
        return slot;
    }

    /**
     * Short pause between consecutive upstream calls of the same batch.
     */
    public void pauseBetweenKinds() throws InterruptedException {
        log.debug("Pausing {}ms between metric kinds", interKindDelay.toMillis());
        sleeper.sleep(interKindDelay);
    }

    /**
     * Backoff after a rate-limit failure: {@code min(baseDelay * 2^attempt, maxDelay)}.
     *
     * @param attempt zero-based retry index for the failing key
     */
    public Duration backoffDelay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt must be >= 0: " + attempt);
        }
        if (attempt >= 62) {
            return maxDelay;
        }
        long factor = 1L << attempt;
        long millis = baseDelay.toMillis();
        if (millis > 0 && factor > Long.MAX_VALUE / millis) {
            return maxDelay;
        }
        Duration delay = Duration.ofMillis(millis * factor);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    public void backoff(int attempt) throws InterruptedException {
        Duration delay = backoffDelay(attempt);
        log.warn("Rate limit hit (attempt {}), sleeping for {}s", attempt + 1, delay.toSeconds());
        sleeper.sleep(delay);
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getInterKindDelay() {
        return interKindDelay;
    }

    /**
     * Exclusive right to call upstream, released on close.
     */
    public final class Slot implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean();

        private Slot() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                upstreamSlot.release();
            }
        }
    }
}
