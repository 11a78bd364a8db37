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
package se.devrandom.mimir.harvest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.devrandom.mimir.ncbi.CredentialSource;
import se.devrandom.mimir.ncbi.LiteratureApi;
import se.devrandom.mimir.storage.ResultSink;
import se.devrandom.mimir.storage.StoreResult;
import se.devrandom.mimir.util.RetryPolicy;
import se.devrandom.mimir.util.RetryUtil;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Fetches one chunk of documents and hands them to the sink.
 * <p>
 * All attempts of the chunk run inside this task, so retries occupy the worker slot the chunk
 * already holds. The task always returns exactly one {@link FetchOutcome} per id of its chunk.
 * <p>
 * Once {@link #abandon} has been called the task stops retrying and writes nothing more to the sink,
 * so the outcomes handed out by {@code abandon} stay true for every id.
 */
public class ChunkDownloadTask implements Callable<List<FetchOutcome>> {
    private static final Logger log = LoggerFactory.getLogger(ChunkDownloadTask.class);

    private final Subject subject;
    private final DocumentChunk chunk;
    private final LiteratureApi api;
    private final ResultSink sink;
    private final CredentialSource credentials;
    private final RetryPolicy retryPolicy;
    private final Duration requestDelay;
    private final BooleanSupplier cancelled;

    private volatile long startedAtNanos = 0L;

    // fair, so a waiting abandon() gets in between two stores
    private final ReentrantLock storeLock = new ReentrantLock(true);
    // guarded by storeLock
    private final List<FetchOutcome> completed = new ArrayList<>();
    private FetchOutcome.FailureKind abandonedAs;
    private String abandonReason;

    public ChunkDownloadTask(
            Subject subject,
            DocumentChunk chunk,
            LiteratureApi api,
            ResultSink sink,
            CredentialSource credentials,
            RetryPolicy retryPolicy,
            Duration requestDelay,
            BooleanSupplier cancelled) {
        this.subject = subject;
        this.chunk = chunk;
        this.api = api;
        this.sink = sink;
        this.credentials = credentials;
        this.retryPolicy = retryPolicy;
        this.requestDelay = requestDelay;
        this.cancelled = cancelled;
    }

    @Override
    public List<FetchOutcome> call() {
        startedAtNanos = System.nanoTime();

        if (isAbandoned()) {
            return remainingAfterAbandon();
        }
        if (cancelled.getAsBoolean()) {
            log.debug("[{}] Chunk {} skipped - subject cancelled", subject.name(), chunk.index());
            return failAll(FetchOutcome.FailureKind.CANCELLED, "Subject cancelled before chunk started");
        }

        List<String> documents;
        try {
            documents = RetryUtil.executeWithRetry(this::fetchVerified, retryPolicy, this::isRetryable, operationName());
        } catch (ChunkMismatchException e) {
            if (isAbandoned()) {
                return remainingAfterAbandon();
            }
            log.error("[{}] Chunk {} permanently failed with count mismatch: {}",
                    subject.name(), chunk.index(), e.getMessage());
            return failAll(FetchOutcome.FailureKind.COUNT_MISMATCH,
                    "Count mismatch after " + retryPolicy.maxAttempts() + " attempts: expected "
                            + e.getExpected() + " documents, got " + e.getActual());
        } catch (Exception e) {
            if (isAbandoned()) {
                return remainingAfterAbandon();
            }
            log.error("[{}] Chunk {} permanently failed: {}", subject.name(), chunk.index(), e.getMessage());
            return failAll(FetchOutcome.FailureKind.TRANSPORT,
                    "Batch failed after retries: " + e.getMessage());
        }

        // documents.size() == chunk.size() is guaranteed by fetchVerified
        for (int i = 0; i < chunk.size(); i++) {
            storeLock.lock();
            try {
                if (abandonedAs != null) {
                    return remainingAfterAbandon();
                }
                completed.add(store(chunk.ids().get(i), documents.get(i)));
            } finally {
                storeLock.unlock();
            }
        }

        List<FetchOutcome> outcomes = snapshot();
        long stored = outcomes.stream().filter(FetchOutcome::persisted).count();
        log.info("[{}] Chunk {}: {}/{} documents stored", subject.name(), chunk.index(), stored, chunk.size());
        return outcomes;
    }

    private boolean isRetryable(Exception e) {
        return !isAbandoned() && RetryUtil.isRetryable(e);
    }

    /**
     * One fetch attempt. The response is only accepted when it holds exactly one document per requested id.
     */
    private List<String> fetchVerified() {
        try {
            List<String> documents = api.fetchDocuments(chunk.ids(), credentials.next());
            if (documents.size() != chunk.size()) {
                throw new ChunkMismatchException(chunk.size(), documents.size());
            }
            return documents;
        } finally {
            RetryUtil.pause(requestDelay);
        }
    }

    private FetchOutcome store(String id, String document) {
        try {
            StoreResult result = sink.store(id, document);
            if (result.success()) {
                log.debug("[{}] Stored {} at {}", subject.name(), id, result.location());
                return FetchOutcome.persisted(id);
            }
            log.error("[{}] Failed to store {}: {}", subject.name(), id, result.error());
            return FetchOutcome.failed(id, FetchOutcome.FailureKind.SINK, result.error());
        } catch (RuntimeException e) {
            log.error("[{}] Sink threw while storing {}: {}", subject.name(), id, e.getMessage(), e);
            return FetchOutcome.failed(id, FetchOutcome.FailureKind.SINK, e.getMessage());
        }
    }

    /**
     * Gives up on the chunk. Ids already handed to the sink keep their recorded outcome and every
     * other id is failed with {@code failure}; the task stores nothing after this returns.
     * Blocks while a store is in progress.
     */
    List<FetchOutcome> abandon(FetchOutcome.FailureKind failure, String error) {
        storeLock.lock();
        try {
            abandonedAs = failure;
            abandonReason = error;
            return withRemainingFailed(failure, error);
        } finally {
            storeLock.unlock();
        }
    }

    private boolean isAbandoned() {
        storeLock.lock();
        try {
            return abandonedAs != null;
        } finally {
            storeLock.unlock();
        }
    }

    private List<FetchOutcome> remainingAfterAbandon() {
        storeLock.lock();
        try {
            log.debug("[{}] Chunk {} abandoned after {} stores, nothing more is written",
                    subject.name(), chunk.index(), completed.size());
            return withRemainingFailed(abandonedAs, abandonReason);
        } finally {
            storeLock.unlock();
        }
    }

    private List<FetchOutcome> snapshot() {
        storeLock.lock();
        try {
            return new ArrayList<>(completed);
        } finally {
            storeLock.unlock();
        }
    }

    private List<FetchOutcome> withRemainingFailed(FetchOutcome.FailureKind failure, String error) {
        List<FetchOutcome> outcomes = new ArrayList<>(completed);
        for (int i = completed.size(); i < chunk.size(); i++) {
            outcomes.add(FetchOutcome.failed(chunk.ids().get(i), failure, error));
        }
        return outcomes;
    }

    private List<FetchOutcome> failAll(FetchOutcome.FailureKind failure, String error) {
        List<FetchOutcome> outcomes = new ArrayList<>(chunk.size());
        for (String id : chunk.ids()) {
            outcomes.add(FetchOutcome.failed(id, failure, error));
        }
        return outcomes;
    }

    private String operationName() {
        return "Download [" + subject.name() + "] chunk " + chunk.index();
    }

    public DocumentChunk getChunk() {
        return chunk;
    }

    public boolean hasStarted() {
        return startedAtNanos != 0L;
    }

    /**
     * Time since the task started running, zero while it is still queued.
     */
    public Duration runningFor() {
        long started = startedAtNanos;
        return started == 0L ? Duration.ZERO : Duration.ofNanos(System.nanoTime() - started);
    }
}
