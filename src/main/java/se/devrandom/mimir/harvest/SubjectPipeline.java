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
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import se.devrandom.mimir.config.MimirProperties;
import se.devrandom.mimir.ncbi.CredentialPool;
import se.devrandom.mimir.ncbi.CredentialSource;
import se.devrandom.mimir.storage.ResultSink;
import se.devrandom.mimir.util.RetryUtil;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one subject end to end: search, optional id mapping, download and storage.
 * Never throws for a single subject's failure; problems end up in the {@link SubjectReport}.
 */
@Service
public class SubjectPipeline {
    private static final Logger log = LoggerFactory.getLogger(SubjectPipeline.class);

    private final PaginatedSearchFetcher searchFetcher;
    private final BatchIdMapper idMapper;
    private final ConcurrentBatchDownloader downloader;
    private final ResultSink sink;
    private final CredentialPool credentialPool;
    private final boolean mappingEnabled;
    private final Duration subjectCooldown;

    // subject name -> cancellation flag of its in-flight run
    private final Map<String, AtomicBoolean> running = new ConcurrentHashMap<>();

    @Autowired
    public SubjectPipeline(PaginatedSearchFetcher searchFetcher,
                           BatchIdMapper idMapper,
                           ConcurrentBatchDownloader downloader,
                           ResultSink sink,
                           CredentialPool credentialPool,
                           MimirProperties properties) {
        this(searchFetcher, idMapper, downloader, sink, credentialPool,
                properties.getMapping().isEnabled(), properties.getSubjectCooldown());
    }

    public SubjectPipeline(PaginatedSearchFetcher searchFetcher,
                           BatchIdMapper idMapper,
                           ConcurrentBatchDownloader downloader,
                           ResultSink sink,
                           CredentialPool credentialPool,
                           boolean mappingEnabled,
                           Duration subjectCooldown) {
        this.searchFetcher = searchFetcher;
        this.idMapper = idMapper;
        this.downloader = downloader;
        this.sink = sink;
        this.credentialPool = credentialPool;
        this.mappingEnabled = mappingEnabled;
        this.subjectCooldown = subjectCooldown;
    }

    public SubjectReport run(Subject subject) {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        running.put(subject.name(), cancelled);
        Instant start = Instant.now();
        log.info("[{}] Starting subject {}", subject.name(), subject.position() + 1);

        try {
            SubjectReport report = harvest(subject, cancelled, start);
            log.info("[{}] Finished with status {} in {}s: {} ids, {} stored, {} failed",
                    subject.name(), report.status(), report.duration().toSeconds(),
                    report.primaryCount(), report.persistedCount(), report.failedCount());
            return report;
        } catch (RuntimeException e) {
            Duration elapsed = Duration.between(start, Instant.now());
            log.error("[{}] Subject failed after {}s: {}", subject.name(), elapsed.toSeconds(), e.getMessage(), e);
            return SubjectReport.failed(subject, elapsed, e.getMessage());
        } finally {
            running.remove(subject.name(), cancelled);
            if (!subjectCooldown.isZero()) {
                log.debug("[{}] Cooling down for {}ms", subject.name(), subjectCooldown.toMillis());
                RetryUtil.pause(subjectCooldown);
            }
        }
    }

    /**
     * Requests cancellation of the in-flight run for the named subject.
     * Chunks already being downloaded finish; chunks not yet started are recorded as cancelled.
     *
     * @return false if no run for that subject is in flight
     */
    public boolean cancel(String subjectName) {
        AtomicBoolean flag = running.get(subjectName);
        if (flag == null) {
            log.warn("Cancellation requested for {} but it is not running", subjectName);
            return false;
        }
        log.info("[{}] Cancellation requested", subjectName);
        flag.set(true);
        return true;
    }

    private SubjectReport harvest(Subject subject, AtomicBoolean cancelled, Instant start) {
        CredentialSource credentials = credentialPool.forSubject();

        SearchResult search = searchFetcher.search(subject, credentials, cancelled::get);
        List<String> primaryIds = new ArrayList<>(new LinkedHashSet<>(search.ids()));
        if (primaryIds.size() < search.ids().size()) {
            log.info("[{}] Dropped {} duplicate ids from search results",
                    subject.name(), search.ids().size() - primaryIds.size());
        }

        if (search.cancelled()) {
            return report(subject, SubjectReport.Status.CANCELLED, search, primaryIds, List.of(), List.of(), start);
        }
        if (primaryIds.isEmpty()) {
            log.info("[{}] No results, skipping mapping and download", subject.name());
            return report(subject, SubjectReport.Status.NO_RESULTS, search, primaryIds, List.of(), List.of(), start);
        }
        log.info("[{}] Search found {} ids in {} pages{}", subject.name(), primaryIds.size(), search.pagesFetched(),
                search.truncated() ? " (truncated)" : "");

        List<MappedId> mappings = List.of();
        List<String> downloadIds = primaryIds;
        if (mappingEnabled) {
            mappings = idMapper.mapIds(subject, primaryIds, credentials);
            downloadIds = new ArrayList<>(new LinkedHashSet<>(mappings.stream()
                    .filter(MappedId::isMapped)
                    .map(mapped -> mapped.secondaryId().get())
                    .toList()));
            if (cancelled.get()) {
                return report(subject, SubjectReport.Status.CANCELLED, search, primaryIds, mappings, List.of(), start);
            }
        }

        List<FetchOutcome> outcomes = downloader.download(subject, downloadIds, sink, credentials, cancelled::get);

        SubjectReport.Status status;
        if (cancelled.get()) {
            status = SubjectReport.Status.CANCELLED;
        } else if (outcomes.stream().anyMatch(FetchOutcome::isFailed)) {
            status = SubjectReport.Status.COMPLETED_WITH_ERRORS;
        } else {
            status = SubjectReport.Status.COMPLETED;
        }
        return report(subject, status, search, primaryIds, mappings, outcomes, start);
    }

    private SubjectReport report(Subject subject, SubjectReport.Status status, SearchResult search,
                                 List<String> primaryIds, List<MappedId> mappings, List<FetchOutcome> outcomes,
                                 Instant start) {
        return new SubjectReport(subject, status, search.truncated(), primaryIds.size(), mappings, outcomes,
                Duration.between(start, Instant.now()), null);
    }
}
