/*
 * Mimir - Literature Harvester
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.mimir.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * How often and how patiently an operation is retried.
 * A policy is either bounded (a fixed number of attempts) or unbounded
 * (retry until the operation succeeds). Delays are fixed, optionally with
 * a random jitter added on top.
 */
public final class RetryPolicy {
    private static final int UNBOUNDED = 0;

    private final int maxAttempts;
    private final Duration delay;
    private final Duration jitter;

    private RetryPolicy(int maxAttempts, Duration delay, Duration jitter) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative: " + maxAttempts);
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be zero or positive");
        }
        if (jitter == null || jitter.isNegative()) {
            throw new IllegalArgumentException("jitter must be zero or positive");
        }
        this.maxAttempts = maxAttempts;
        this.delay = delay;
        this.jitter = jitter;
    }

    public static RetryPolicy bounded(int maxAttempts, Duration delay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("A bounded policy needs at least one attempt: " + maxAttempts);
        }
        return new RetryPolicy(maxAttempts, delay, Duration.ZERO);
    }

    public static RetryPolicy unbounded(Duration delay) {
        return new RetryPolicy(UNBOUNDED, delay, Duration.ZERO);
    }

    public RetryPolicy withJitter(Duration jitter) {
        return new RetryPolicy(maxAttempts, delay, jitter);
    }

    public boolean isUnbounded() {
        return maxAttempts == UNBOUNDED;
    }

    /**
     * @return the attempt limit, or {@code Integer.MAX_VALUE} for unbounded policies
     */
    public int maxAttempts() {
        return isUnbounded() ? Integer.MAX_VALUE : maxAttempts;
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return isUnbounded() || attemptsMade < maxAttempts;
    }

    public Duration delay() {
        return delay;
    }

    public Duration jitter() {
        return jitter;
    }

    /**
     * Delay before the next attempt: the fixed delay plus a uniform random jitter.
     */
    public long nextDelayMs() {
        long base = delay.toMillis();
        long jitterMs = jitter.toMillis();
        if (jitterMs <= 0) {
            return base;
        }
        return base + ThreadLocalRandom.current().nextLong(jitterMs + 1);
    }

    @Override
    public String toString() {
        return isUnbounded()
                ? "unbounded, delay " + delay.toMillis() + "ms"
                : maxAttempts + " attempts, delay " + delay.toMillis() + "ms";
    }
}
