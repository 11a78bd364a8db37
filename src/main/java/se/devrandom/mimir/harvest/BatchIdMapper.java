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
import se.devrandom.mimir.ncbi.CredentialSource;
import se.devrandom.mimir.ncbi.LiteratureApi;
import se.devrandom.mimir.ncbi.MalformedResponseException;
import se.devrandom.mimir.ncbi.UpstreamException;
import se.devrandom.mimir.util.Partitioner;
import se.devrandom.mimir.util.RetryPolicy;
import se.devrandom.mimir.util.RetryUtil;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Resolves primary ids to the secondary id space in fixed-size chunks, one request per chunk.
 * Output has the same length and order as the input; ids without a mapping come back unmapped.
 */
@Service
public class BatchIdMapper {
    private static final Logger log = LoggerFactory.getLogger(BatchIdMapper.class);

    private final LiteratureApi api;
    private final int chunkSize;
    private final RetryPolicy retryPolicy;
    private final Duration requestDelay;
    private final MalformedResponsePolicy malformedResponsePolicy;

    @Autowired
    public BatchIdMapper(LiteratureApi api, MimirProperties properties) {
        this(api,
                properties.getMapping().getChunkSize(),
                RetryPolicy.unbounded(properties.getRetryDelay()).withJitter(properties.getRetryJitter()),
                properties.getRequestDelay(),
                properties.getMapping().getMalformedResponsePolicy());
    }

    public BatchIdMapper(LiteratureApi api, int chunkSize, RetryPolicy retryPolicy, Duration requestDelay,
                         MalformedResponsePolicy malformedResponsePolicy) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be at least 1: " + chunkSize);
        }
        this.api = api;
        this.chunkSize = chunkSize;
        this.retryPolicy = retryPolicy;
        this.requestDelay = requestDelay;
        this.malformedResponsePolicy = malformedResponsePolicy == null
                ? MalformedResponsePolicy.RETRY
                : malformedResponsePolicy;
    }

    public List<MappedId> mapIds(Subject subject, List<String> ids, CredentialSource credentials) {
        List<List<String>> chunks = Partitioner.partition(ids, chunkSize);
        List<MappedId> mapped = new ArrayList<>(ids.size());

        log.info("[{}] Mapping {} ids in {} chunks", subject.name(), ids.size(), chunks.size());

        for (int i = 0; i < chunks.size(); i++) {
            mapped.addAll(mapChunk(subject, i + 1, chunks.get(i), credentials));
            if (i < chunks.size() - 1) {
                RetryUtil.pause(requestDelay);
            }
        }

        long mappedCount = mapped.stream().filter(MappedId::isMapped).count();
        log.info("[{}] Mapped {} of {} ids", subject.name(), mappedCount, ids.size());
        return mapped;
    }

    private List<MappedId> mapChunk(Subject subject, int chunkIndex, List<String> chunk, CredentialSource credentials) {
        String operation = "Id mapping [" + subject.name() + "] chunk " + chunkIndex;

        Predicate<Exception> retryable = RetryUtil::isRetryable;
        if (malformedResponsePolicy == MalformedResponsePolicy.FAIL_CHUNK) {
            retryable = e -> !(e instanceof MalformedResponseException) && RetryUtil.isRetryable(e);
        }

        Map<String, String> lookup;
        try {
            lookup = RetryUtil.executeWithRetry(() -> api.mapIds(chunk, credentials.next()),
                    retryPolicy, retryable, operation);
        } catch (MalformedResponseException e) {
            log.error("{} returned an unparseable body, leaving {} ids unmapped: {}",
                    operation, chunk.size(), e.getMessage());
            List<MappedId> failed = new ArrayList<>(chunk.size());
            for (String id : chunk) {
                failed.add(MappedId.malformed(id));
            }
            return failed;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new UpstreamException(operation + " aborted: " + e.getMessage(), e);
        }

        List<MappedId> result = new ArrayList<>(chunk.size());
        for (String id : chunk) {
            result.add(MappedId.of(id, lookup.get(id)));
        }
        return result;
    }
}
