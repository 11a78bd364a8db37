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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import se.devrandom.mimir.ncbi.MalformedResponseException;
import se.devrandom.mimir.ncbi.UpstreamException;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryUtilTest {

    @Test
    @DisplayName("Bounded policy stops after the configured number of attempts")
    void boundedPolicyGivesUp() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> RetryUtil.executeWithRetry(() -> {
            calls.incrementAndGet();
            throw new UpstreamException("HTTP 500");
        }, RetryPolicy.bounded(3, Duration.ZERO), "test"))
                .isInstanceOf(UpstreamException.class)
                .hasMessage("HTTP 500");

        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Unbounded policy keeps retrying until the operation succeeds")
    void unboundedPolicyRetriesUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = RetryUtil.executeWithRetry(() -> {
            if (calls.incrementAndGet() < 25) {
                throw new IOException("connection reset");
            }
            return "ok";
        }, RetryPolicy.unbounded(Duration.ZERO), "test");

        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(25);
    }

    @Test
    void nonRetryableErrorFailsImmediately() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> RetryUtil.executeWithRetry(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        }, RetryPolicy.unbounded(Duration.ZERO), "test"))
                .isInstanceOf(IllegalStateException.class);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("An interrupted thread is not retried, even under an unbounded policy")
    void interruptedThreadStopsRetrying() {
        AtomicInteger calls = new AtomicInteger();

        try {
            assertThatThrownBy(() -> RetryUtil.executeWithRetry(() -> {
                calls.incrementAndGet();
                Thread.currentThread().interrupt();
                throw new UpstreamException("esearch failed");
            }, RetryPolicy.unbounded(Duration.ZERO), "test"))
                    .isInstanceOf(UpstreamException.class);

            assertThat(calls.get()).isEqualTo(1);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void customPredicateCanExcludeMalformedResponses() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> RetryUtil.executeWithRetry(() -> {
            calls.incrementAndGet();
            throw new MalformedResponseException("not json");
        }, RetryPolicy.unbounded(Duration.ZERO),
                e -> !(e instanceof MalformedResponseException) && RetryUtil.isRetryable(e),
                "test"))
                .isInstanceOf(MalformedResponseException.class);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void classifiesRetryableErrors() {
        assertThat(RetryUtil.isRetryable(new UpstreamException("x"))).isTrue();
        assertThat(RetryUtil.isRetryable(new MalformedResponseException("x"))).isTrue();
        assertThat(RetryUtil.isRetryable(new IOException("x"))).isTrue();
        assertThat(RetryUtil.isRetryable(new RuntimeException(new IOException("x")))).isTrue();
        assertThat(RetryUtil.isRetryable(new IllegalArgumentException("x"))).isFalse();
    }

    @Test
    void policyReportsAttemptLimits() {
        RetryPolicy bounded = RetryPolicy.bounded(3, Duration.ofSeconds(1));
        RetryPolicy unbounded = RetryPolicy.unbounded(Duration.ofSeconds(1));

        assertThat(bounded.hasAttemptsLeft(2)).isTrue();
        assertThat(bounded.hasAttemptsLeft(3)).isFalse();
        assertThat(unbounded.hasAttemptsLeft(1_000_000)).isTrue();
        assertThat(unbounded.maxAttempts()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void jitterStaysWithinBounds() {
        RetryPolicy policy = RetryPolicy.bounded(2, Duration.ofMillis(100)).withJitter(Duration.ofMillis(50));

        for (int i = 0; i < 100; i++) {
            assertThat(policy.nextDelayMs()).isBetween(100L, 150L);
        }
    }
}
