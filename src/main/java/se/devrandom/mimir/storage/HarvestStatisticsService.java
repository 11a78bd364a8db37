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
package se.devrandom.mimir.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import se.devrandom.mimir.harvest.FetchOutcome;
import se.devrandom.mimir.harvest.SubjectReport;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe statistics for a harvest job. Subjects finish on different threads and report here.
 */
@Service
public class HarvestStatisticsService {
    private static final Logger log = LoggerFactory.getLogger(HarvestStatisticsService.class);
    private static final int MAX_LISTED_FAILURES = 10;

    private final AtomicLong subjectsProcessed = new AtomicLong(0);
    private final AtomicLong primaryIds = new AtomicLong(0);
    private final AtomicLong mappedIds = new AtomicLong(0);
    private final AtomicLong unmappedIds = new AtomicLong(0);
    private final AtomicLong documentsStored = new AtomicLong(0);
    private final AtomicLong documentsFailed = new AtomicLong(0);
    private final AtomicLong truncatedSubjects = new AtomicLong(0);
    private final Map<FetchOutcome.FailureKind, AtomicLong> failuresByKind = new EnumMap<>(FetchOutcome.FailureKind.class);
    private final Map<SubjectReport.Status, AtomicLong> subjectsByStatus = new EnumMap<>(SubjectReport.Status.class);

    private final ConcurrentLinkedQueue<SubjectReport> reports = new ConcurrentLinkedQueue<>();

    private volatile Instant jobStartTime = Instant.now();
    private volatile Instant jobEndTime;

    public HarvestStatisticsService() {
        for (FetchOutcome.FailureKind kind : FetchOutcome.FailureKind.values()) {
            failuresByKind.put(kind, new AtomicLong(0));
        }
        for (SubjectReport.Status status : SubjectReport.Status.values()) {
            subjectsByStatus.put(status, new AtomicLong(0));
        }
    }

    public void markJobStarted() {
        this.jobStartTime = Instant.now();
        this.jobEndTime = null;
    }

    public void recordSubject(SubjectReport report) {
        reports.add(report);
        subjectsProcessed.incrementAndGet();
        subjectsByStatus.get(report.status()).incrementAndGet();
        primaryIds.addAndGet(report.primaryCount());
        mappedIds.addAndGet(report.mappedCount());
        unmappedIds.addAndGet(report.unmappedCount());
        if (report.truncated()) {
            truncatedSubjects.incrementAndGet();
        }
        for (FetchOutcome outcome : report.outcomes()) {
            if (outcome.persisted()) {
                documentsStored.incrementAndGet();
            } else {
                documentsFailed.incrementAndGet();
                if (outcome.failure() != null) {
                    failuresByKind.get(outcome.failure()).incrementAndGet();
                }
            }
        }
        log.debug("Recorded subject {}: {}", report.subject().name(), report.status());
    }

    /**
     * @return the recorded reports in configured subject order
     */
    public List<SubjectReport> getReports() {
        List<SubjectReport> sorted = new ArrayList<>(reports);
        sorted.sort((a, b) -> Integer.compare(a.subject().position(), b.subject().position()));
        return sorted;
    }

    public long getSubjectsProcessed() {
        return subjectsProcessed.get();
    }

    public long getSubjectCount(SubjectReport.Status status) {
        return subjectsByStatus.get(status).get();
    }

    public long getPrimaryIds() {
        return primaryIds.get();
    }

    public long getMappedIds() {
        return mappedIds.get();
    }

    public long getDocumentsStored() {
        return documentsStored.get();
    }

    public long getDocumentsFailed() {
        return documentsFailed.get();
    }

    public long getFailures(FetchOutcome.FailureKind kind) {
        return failuresByKind.get(kind).get();
    }

    public void markJobComplete() {
        this.jobEndTime = Instant.now();
    }

    /**
     * Generates the summary block logged at the end of the job.
     */
    public String generateSummaryReport() {
        if (jobEndTime == null) {
            markJobComplete();
        }

        Duration duration = Duration.between(jobStartTime, jobEndTime);
        long minutes = duration.toMinutes();
        long seconds = duration.getSeconds() % 60;

        StringBuilder report = new StringBuilder();
        report.append("\n");
        report.append(String.format("Duration: %dm %ds%n", minutes, seconds));
        report.append("\n");

        report.append("Subjects:\n");
        report.append(String.format("  - Processed: %,d%n", subjectsProcessed.get()));
        for (SubjectReport.Status status : SubjectReport.Status.values()) {
            long count = subjectsByStatus.get(status).get();
            if (count > 0) {
                report.append(String.format("    • %s: %,d%n", status, count));
            }
        }
        if (truncatedSubjects.get() > 0) {
            report.append(String.format("  - Truncated at paging limit: %,d%n", truncatedSubjects.get()));
        }
        report.append("\n");

        report.append("Identifiers:\n");
        report.append(String.format("  - Found by search: %,d%n", primaryIds.get()));
        if (mappedIds.get() + unmappedIds.get() > 0) {
            report.append(String.format("  - Mapped: %,d%n", mappedIds.get()));
            report.append(String.format("  - Without mapping: %,d%n", unmappedIds.get()));
        }
        report.append("\n");

        report.append("Documents:\n");
        report.append(String.format("  - Stored: %,d%n", documentsStored.get()));
        report.append(String.format("  - Failed: %,d%n", documentsFailed.get()));
        for (FetchOutcome.FailureKind kind : FetchOutcome.FailureKind.values()) {
            long count = failuresByKind.get(kind).get();
            if (count > 0) {
                report.append(String.format("    • %s: %,d%n", kind, count));
            }
        }
        report.append("\n");

        List<SubjectReport> failedSubjects = getReports().stream()
                .filter(r -> r.status() == SubjectReport.Status.FAILED)
                .toList();
        if (!failedSubjects.isEmpty()) {
            report.append(String.format("Failed subjects (first %d):%n", MAX_LISTED_FAILURES));
            failedSubjects.stream().limit(MAX_LISTED_FAILURES).forEach(r ->
                    report.append(String.format("  - %s: %s%n", r.subject().name(), r.error())));
            if (failedSubjects.size() > MAX_LISTED_FAILURES) {
                report.append(String.format("  ... and %d more%n", failedSubjects.size() - MAX_LISTED_FAILURES));
            }
            report.append("\n");
        }

        long stored = documentsStored.get();
        long failed = documentsFailed.get();
        double failureRate = stored + failed > 0 ? (double) failed / (stored + failed) : 0.0;

        String status;
        if (subjectsByStatus.get(SubjectReport.Status.FAILED).get() > 0 || failureRate > 0.5) {
            status = "FAILED";
        } else if (failureRate > 0.1) {
            status = "WARNING (>10% failure rate)";
        } else {
            status = "SUCCESS";
        }
        report.append(String.format("Overall Status: %s", status));

        return report.toString();
    }

    public void reset() {
        subjectsProcessed.set(0);
        primaryIds.set(0);
        mappedIds.set(0);
        unmappedIds.set(0);
        documentsStored.set(0);
        documentsFailed.set(0);
        truncatedSubjects.set(0);
        failuresByKind.values().forEach(counter -> counter.set(0));
        subjectsByStatus.values().forEach(counter -> counter.set(0));
        reports.clear();
        jobStartTime = Instant.now();
        jobEndTime = null;

        log.info("Statistics reset");
    }
}
