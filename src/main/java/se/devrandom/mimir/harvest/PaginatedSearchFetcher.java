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
import se.devrandom.mimir.ncbi.UpstreamException;
import se.devrandom.mimir.util.RetryPolicy;
import se.devrandom.mimir.util.RetryUtil;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Pages through the search endpoint until the result set is exhausted or the upstream paging limit is hit.
 * <p>
 * A failed page is retried at the same offset without limit, so a subject's id list is never
 * abandoned half way. Every retry is logged with subject, offset and attempt number to make a
 * stalled search visible.
 */
@Service
public class PaginatedSearchFetcher {
    private static final Logger log = LoggerFactory.getLogger(PaginatedSearchFetcher.class);

    private final LiteratureApi api;
    private final int pageSize;
    private final int maxOffset;
    private final RetryPolicy retryPolicy;
    private final Duration requestDelay;

    @Autowired
    public PaginatedSearchFetcher(LiteratureApi api, MimirProperties properties) {
        this(api,
                properties.getSearch().getPageSize(),
                properties.getSearch().getMaxOffset(),
                RetryPolicy.unbounded(properties.getRetryDelay()).withJitter(properties.getRetryJitter()),
                properties.getRequestDelay());
    }

    public PaginatedSearchFetcher(LiteratureApi api, int pageSize, int maxOffset,
                                  RetryPolicy retryPolicy, Duration requestDelay) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be at least 1: " + pageSize);
        }
        this.api = api;
        this.pageSize = pageSize;
        this.maxOffset = maxOffset;
        this.retryPolicy = retryPolicy;
        this.requestDelay = requestDelay;
    }

    public SearchResult search(Subject subject, CredentialSource credentials) {
        return search(subject, credentials, () -> false);
    }

    public SearchResult search(Subject subject, CredentialSource credentials, BooleanSupplier cancelled) {
        List<String> ids = new ArrayList<>();
        int offset = 0;
        int pages = 0;

        while (true) {
            if (cancelled.getAsBoolean()) {
                log.info("[{}] Search cancelled at offset {} with {} ids collected", subject.name(), offset, ids.size());
                return new SearchResult(ids, false, true, pages);
            }

            List<String> page = fetchPage(subject, offset, credentials);
            pages++;

            if (page.isEmpty()) {
                log.debug("[{}] Search exhausted at offset {}", subject.name(), offset);
                break;
            }

            ids.addAll(page);
            offset += page.size();
            log.debug("[{}] Page {} returned {} ids (total {})", subject.name(), pages, page.size(), ids.size());

            if (offset >= maxOffset) {
                log.warn("[{}] Reached upstream paging limit of {} results - result set may be incomplete",
                        subject.name(), maxOffset);
                return new SearchResult(ids, true, false, pages);
            }

            RetryUtil.pause(requestDelay);
        }

        return new SearchResult(ids, false, false, pages);
    }

    private List<String> fetchPage(Subject subject, int offset, CredentialSource credentials) {
        String operation = "Search [" + subject.name() + "] offset=" + offset;
        try {
            return RetryUtil.executeWithRetry(
                    () -> api.searchPage(subject.searchTerm(), offset, pageSize, credentials.next()),
                    retryPolicy,
                    operation);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new UpstreamException(operation + " aborted: " + e.getMessage(), e);
        }
    }
}
