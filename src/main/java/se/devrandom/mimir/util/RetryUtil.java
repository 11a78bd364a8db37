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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import se.devrandom.mimir.ncbi.UpstreamException;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Utility class for executing operations with a {@link RetryPolicy}.
 * Only retries transient errors (upstream failures, network issues, HTTP error statuses).
 * Programming errors and other application-level failures are not retried.
 */
public class RetryUtil {
    private static final Logger log = LoggerFactory.getLogger(RetryUtil.class);

    private RetryUtil() {
    }

    /**
     * Executes the given operation, retrying transient errors as the policy allows.
     *
     * @param operation     The operation to execute
     * @param policy        Attempt limit and delay between attempts
     * @param operationName Name of the operation for logging purposes (subject, chunk, offset)
     * @param <T>           Return type of the operation
     * @return The result from the operation
     * @throws Exception if all retry attempts are exhausted or a non-retryable error occurs
     */
    public static <T> T executeWithRetry(
            Callable<T> operation,
            RetryPolicy policy,
            String operationName) throws Exception {
        return executeWithRetry(operation, policy, RetryUtil::isRetryable, operationName);
    }

    /**
     * Same as {@link #executeWithRetry(Callable, RetryPolicy, String)} with a caller supplied
     * decision on which errors are worth another attempt.
     */
    public static <T> T executeWithRetry(
            Callable<T> operation,
            RetryPolicy policy,
            Predicate<Exception> retryable,
            String operationName) throws Exception {

        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return operation.call();
            } catch (Exception e) {
                if (!retryable.test(e)) {
                    log.error("{} failed with non-retryable error: {}",
                            operationName, e.getClass().getSimpleName(), e);
                    throw e;
                }

                if (Thread.currentThread().isInterrupted()) {
                    log.warn("{} interrupted on attempt {}, not retrying: {}", operationName, attempt, e.getMessage());
                    throw e;
                }

                if (!policy.hasAttemptsLeft(attempt)) {
                    log.error("{} failed after {} attempts: {}", operationName, attempt, e.getMessage());
                    throw e;
                }

                long delayMs = policy.nextDelayMs();
                if (policy.isUnbounded()) {
                    log.warn("{} attempt {} failed, retrying in {}ms (no attempt limit): {}",
                            operationName, attempt, delayMs, e.getMessage());
                } else {
                    log.warn("{} attempt {}/{} failed, retrying in {}ms: {}",
                            operationName, attempt, policy.maxAttempts(), delayMs, e.getMessage());
                }

                sleep(delayMs, "Retry interrupted");
            }
        }
    }

    /**
     * Blocks for the given fixed delay. Used between upstream requests to stay inside the rate budget.
     */
    public static void pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        sleep(delay.toMillis(), "Interrupted during request delay");
    }

    private static void sleep(long delayMs, String interruptMessage) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(interruptMessage, ie);
        }
    }

    /**
     * Determines if an exception is retryable (transient error) or not.
     *
     * Retryable errors:
     * - UpstreamException (transport failure, non-success status, malformed body, count mismatch)
     * - IOException (network timeouts, connection failures)
     * - WebClient request/response exceptions (any status: the upstream quota answers 429 or 5xx)
     *
     * @param e The exception to check
     * @return true if the error is retryable, false otherwise
     */
    public static boolean isRetryable(Exception e) {
        if (e instanceof UpstreamException || e instanceof IOException) {
            return true;
        }

        if (e instanceof WebClientResponseException || e instanceof WebClientRequestException) {
            return true;
        }

        // RuntimeException wrapping retryable exceptions
        if (e instanceof RuntimeException && e.getCause() instanceof Exception cause && cause != e) {
            if (cause instanceof IOException
                    || cause instanceof UpstreamException
                    || cause instanceof WebClientResponseException
                    || cause instanceof WebClientRequestException) {
                return isRetryable(cause);
            }
        }

        log.debug("Non-retryable exception type: {}", e.getClass().getName());
        return false;
    }
}
