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

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import se.devrandom.mimir.config.MimirProperties;
import se.devrandom.mimir.ncbi.CredentialSource;
import se.devrandom.mimir.ncbi.LiteratureApi;
import se.devrandom.mimir.storage.ResultSink;
import se.devrandom.mimir.util.Partitioner;
import se.devrandom.mimir.util.RetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Downloads documents in fixed-size chunks on a bounded worker pool and hands every document to a {@link ResultSink}.
 * <p>
 * The pool is shared by all subjects, so at most {@code concurrency} chunk requests are in flight
 * process-wide no matter how many subjects run at once. A chunk is given {@code chunkTimeout} from
 * the moment a worker picks it up; time spent queued does not count.
 */
@Service
public class ConcurrentBatchDownloader {
    private static final Logger log = LoggerFactory.getLogger(ConcurrentBatchDownloader.class);
    private static final long PROGRESS_LOG_INTERVAL_MS = 30_000;

    private final LiteratureApi api;
    private final int chunkSize;
    private final int concurrency;
    private final RetryPolicy retryPolicy;
    private final Duration requestDelay;
    private final Duration chunkTimeout;
    private final long pollIntervalMs;
    private final ExecutorService executor;

    @Autowired
    public ConcurrentBatchDownloader(LiteratureApi api, MimirProperties properties) {
        this(api,
                properties.getDownload().getChunkSize(),
                properties.getDownload().getConcurrency(),
                RetryPolicy.bounded(properties.getDownload().getMaxAttempts(), properties.getRetryDelay())
                        .withJitter(properties.getRetryJitter()),
                properties.getRequestDelay(),
                properties.getDownload().getChunkTimeout());
    }

    public ConcurrentBatchDownloader(LiteratureApi api, int chunkSize, int concurrency, RetryPolicy retryPolicy,
                                     Duration requestDelay, Duration chunkTimeout) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be at least 1: " + chunkSize);
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
        }
        if (chunkTimeout == null || chunkTimeout.isZero() || chunkTimeout.isNegative()) {
            throw new IllegalArgumentException("chunkTimeout must be positive");
        }
        this.api = api;
        this.chunkSize = chunkSize;
        this.concurrency = concurrency;
        this.retryPolicy = retryPolicy;
        this.requestDelay = requestDelay;
        this.chunkTimeout = chunkTimeout;
        this.pollIntervalMs = Math.max(10, Math.min(1000, chunkTimeout.toMillis() / 10));
        this.executor = Executors.newFixedThreadPool(concurrency, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("chunk-download-" + counter.getAndIncrement());
                thread.setDaemon(false);
                return thread;
            }
        });
        log.info("Document downloader ready: chunk size {}, {} workers, retry {}, chunk timeout {}ms",
                chunkSize, concurrency, retryPolicy, chunkTimeout.toMillis());
    }

    public List<FetchOutcome> download(Subject subject, List<String> ids, ResultSink sink, CredentialSource credentials) {
        return download(subject, ids, sink, credentials, () -> false);
    }

    /**
     * Downloads every id and returns exactly one outcome per id, in input order.
     * Blocks until every chunk has finished, failed, timed out or been cancelled.
     */
    public List<FetchOutcome> download(Subject subject, List<String> ids, ResultSink sink,
                                       CredentialSource credentials, BooleanSupplier cancelled) {
        List<List<String>> partitions = Partitioner.partition(ids, chunkSize);
        if (partitions.isEmpty()) {
            return List.of();
        }

        log.info("[{}] Downloading {} documents in {} chunks to {}",
                subject.name(), ids.size(), partitions.size(), sink.describe());

        List<ChunkDownloadTask> tasks = new ArrayList<>(partitions.size());
        List<Future<List<FetchOutcome>>> futures = new ArrayList<>(partitions.size());
        for (int i = 0; i < partitions.size(); i++) {
            ChunkDownloadTask task = new ChunkDownloadTask(subject, new DocumentChunk(i + 1, partitions.get(i)),
                    api, sink, credentials, retryPolicy, requestDelay, cancelled);
            tasks.add(task);
            futures.add(executor.submit(task));
        }

        List<FetchOutcome> outcomes = new ArrayList<>(ids.size());
        int persisted = 0;
        int failed = 0;
        long lastProgressLog = System.currentTimeMillis();

        for (int i = 0; i < tasks.size(); i++) {
            List<FetchOutcome> chunkOutcomes = await(subject, tasks.get(i), futures.get(i));
            for (FetchOutcome outcome : chunkOutcomes) {
                if (outcome.persisted()) {
                    persisted++;
                } else {
                    failed++;
                }
            }
            outcomes.addAll(chunkOutcomes);

            long now = System.currentTimeMillis();
            if (now - lastProgressLog >= PROGRESS_LOG_INTERVAL_MS) {
                log.info("[{}] Download progress: {}/{} chunks, {} stored, {} failed",
                        subject.name(), i + 1, tasks.size(), persisted, failed);
                lastProgressLog = now;
            }
        }

        log.info("[{}] Download complete: {} stored, {} failed of {}", subject.name(), persisted, failed, ids.size());
        return outcomes;
    }

    private List<FetchOutcome> await(Subject subject, ChunkDownloadTask task, Future<List<FetchOutcome>> future) {
        DocumentChunk chunk = task.getChunk();
        while (true) {
            try {
                return future.get(pollIntervalMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (task.hasStarted() && task.runningFor().compareTo(chunkTimeout) > 0) {
                    log.error("[{}] Chunk {} timed out after {}ms - cancelling", subject.name(), chunk.index(),
                            chunkTimeout.toMillis());
                    List<FetchOutcome> outcomes = task.abandon(FetchOutcome.FailureKind.TIMEOUT,
                            "Chunk did not complete within " + chunkTimeout.toMillis() + "ms");
                    future.cancel(true);
                    return outcomes;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("[{}] Interrupted while waiting for chunk {}", subject.name(), chunk.index());
                List<FetchOutcome> outcomes = task.abandon(FetchOutcome.FailureKind.CANCELLED,
                        "Interrupted while waiting for chunk");
                future.cancel(true);
                return outcomes;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("[{}] Chunk {} failed unexpectedly", subject.name(), chunk.index(), cause);
                return task.abandon(FetchOutcome.FailureKind.TRANSPORT, cause.getMessage());
            }
        }
    }

    public int getConcurrency() {
        return concurrency;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Download workers did not terminate in 60 seconds, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for download workers to stop", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
