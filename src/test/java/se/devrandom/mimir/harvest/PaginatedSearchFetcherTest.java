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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import se.devrandom.mimir.ncbi.Credential;
import se.devrandom.mimir.ncbi.CredentialPool;
import se.devrandom.mimir.ncbi.LiteratureApi;
import se.devrandom.mimir.ncbi.MalformedResponseException;
import se.devrandom.mimir.ncbi.UpstreamException;
import se.devrandom.mimir.util.RetryPolicy;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaginatedSearchFetcherTest {

    private static final CredentialPool CREDENTIALS = new CredentialPool(List.of(
            new Credential("a@example.org", "key-a"),
            new Credential("b@example.org", "key-b")));

    @Mock
    private LiteratureApi api;

    private PaginatedSearchFetcher fetcher(int pageSize, int maxOffset) {
        return new PaginatedSearchFetcher(api, pageSize, maxOffset, RetryPolicy.unbounded(Duration.ZERO), Duration.ZERO);
    }

    @Test
    @DisplayName("TESTGENE: pages [p1,p2], [p3], [] give p1, p2, p3 in order")
    void collectsPagesInOrder() {
        when(api.searchPage(eq("\"TESTGENE\""), anyInt(), eq(2), any(Credential.class)))
                .thenReturn(List.of("p1", "p2"))
                .thenReturn(List.of("p3"))
                .thenReturn(List.of());

        SearchResult result = fetcher(2, 9999).search(new Subject("TESTGENE", 0), CREDENTIALS);

        assertThat(result.ids()).containsExactly("p1", "p2", "p3");
        assertThat(result.truncated()).isFalse();
        assertThat(result.cancelled()).isFalse();
        assertThat(result.pagesFetched()).isEqualTo(3);
    }

    @Test
    @DisplayName("No offset is requested twice on the happy path")
    void neverRepeatsAnOffset() {
        when(api.searchPage(any(), anyInt(), anyInt(), any()))
                .thenReturn(List.of("p1", "p2"))
                .thenReturn(List.of("p3", "p4"))
                .thenReturn(List.of("p5"))
                .thenReturn(List.of());

        fetcher(2, 9999).search(new Subject("GENE", 0), CREDENTIALS);

        ArgumentCaptor<Integer> offsets = ArgumentCaptor.forClass(Integer.class);
        verify(api, times(4)).searchPage(any(), offsets.capture(), anyInt(), any());
        assertThat(offsets.getAllValues()).containsExactly(0, 2, 4, 5).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("A failing page is retried at the same offset until it succeeds")
    void retriesSameOffsetWithoutLimit() {
        AtomicInteger failures = new AtomicInteger();
        when(api.searchPage(any(), anyInt(), anyInt(), any())).thenAnswer(invocation -> {
            int offset = invocation.getArgument(1);
            if (offset == 2 && failures.incrementAndGet() <= 7) {
                throw failures.get() % 2 == 0
                        ? new MalformedResponseException("garbled")
                        : new UpstreamException("HTTP 502", 502, null);
            }
            return switch (offset) {
                case 0 -> List.of("p1", "p2");
                case 2 -> List.of("p3");
                default -> List.of();
            };
        });

        SearchResult result = fetcher(2, 9999).search(new Subject("GENE", 0), CREDENTIALS);

        assertThat(result.ids()).containsExactly("p1", "p2", "p3");
        verify(api, times(8)).searchPage(any(), eq(2), anyInt(), any());
    }

    @Test
    @DisplayName("Reaching the paging ceiling stops the search and marks it truncated")
    void truncatesAtMaxOffset() {
        when(api.searchPage(any(), anyInt(), anyInt(), any()))
                .thenReturn(List.of("p1", "p2"))
                .thenReturn(List.of("p3", "p4"));

        SearchResult result = fetcher(2, 4).search(new Subject("GENE", 0), CREDENTIALS);

        assertThat(result.ids()).containsExactly("p1", "p2", "p3", "p4");
        assertThat(result.truncated()).isTrue();
        verify(api, never()).searchPage(any(), eq(4), anyInt(), any());
    }

    @Test
    void emptyFirstPageGivesEmptyResult() {
        when(api.searchPage(any(), anyInt(), anyInt(), any())).thenReturn(List.of());

        SearchResult result = fetcher(10, 9999).search(new Subject("NOTHING", 0), CREDENTIALS);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.truncated()).isFalse();
    }

    @Test
    void cancelledSearchStopsBeforeNextPage() {
        AtomicInteger pages = new AtomicInteger();
        when(api.searchPage(any(), anyInt(), anyInt(), any())).thenAnswer(invocation -> {
            pages.incrementAndGet();
            return List.of("p" + pages.get());
        });

        SearchResult result = fetcher(1, 9999).search(new Subject("GENE", 0), CREDENTIALS, () -> pages.get() >= 2);

        assertThat(result.cancelled()).isTrue();
        assertThat(result.ids()).containsExactly("p1", "p2");
    }
}
