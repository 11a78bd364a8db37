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
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import se.devrandom.mimir.ncbi.Credential;
import se.devrandom.mimir.ncbi.CredentialPool;
import se.devrandom.mimir.ncbi.LiteratureApi;
import se.devrandom.mimir.ncbi.MalformedResponseException;
import se.devrandom.mimir.util.RetryPolicy;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchIdMapperTest {

    private static final CredentialPool CREDENTIALS = new CredentialPool(List.of(new Credential("a@example.org", "key-a")));
    private static final Subject SUBJECT = new Subject("GENE", 0);

    @Mock
    private LiteratureApi api;

    private BatchIdMapper mapper(int chunkSize, MalformedResponsePolicy policy) {
        return new BatchIdMapper(api, chunkSize, RetryPolicy.unbounded(Duration.ZERO), Duration.ZERO, policy);
    }

    @Test
    @DisplayName("Output has the same length and order as the input, unmapped ids included")
    void preservesOrderAndLength() {
        when(api.mapIds(eq(List.of("1", "2")), any())).thenReturn(Map.of("1", "PMC1"));
        when(api.mapIds(eq(List.of("3")), any())).thenReturn(Map.of("3", "PMC3"));

        List<MappedId> mapped = mapper(2, MalformedResponsePolicy.RETRY).mapIds(SUBJECT, List.of("1", "2", "3"), CREDENTIALS);

        assertThat(mapped).extracting(MappedId::primaryId).containsExactly("1", "2", "3");
        assertThat(mapped).extracting(MappedId::secondaryId)
                .containsExactly(Optional.of("PMC1"), Optional.empty(), Optional.of("PMC3"));
        assertThat(mapped.get(1).malformed()).isFalse();
    }

    @Test
    @DisplayName("RETRY policy retries a garbled chunk until it parses")
    void retryPolicyRetriesMalformedChunk() {
        when(api.mapIds(eq(List.of("1")), any()))
                .thenThrow(new MalformedResponseException("not json"))
                .thenThrow(new MalformedResponseException("not json"))
                .thenReturn(Map.of("1", "PMC1"));

        List<MappedId> mapped = mapper(5, MalformedResponsePolicy.RETRY).mapIds(SUBJECT, List.of("1"), CREDENTIALS);

        assertThat(mapped).containsExactly(MappedId.of("1", "PMC1"));
        verify(api, times(3)).mapIds(eq(List.of("1")), any());
    }

    @Test
    @DisplayName("FAIL_CHUNK policy marks the garbled chunk malformed and carries on with the next one")
    void failChunkPolicyMarksChunkMalformed() {
        when(api.mapIds(eq(List.of("1", "2")), any())).thenThrow(new MalformedResponseException("not json"));
        when(api.mapIds(eq(List.of("3")), any())).thenReturn(Map.of("3", "PMC3"));

        List<MappedId> mapped = mapper(2, MalformedResponsePolicy.FAIL_CHUNK)
                .mapIds(SUBJECT, List.of("1", "2", "3"), CREDENTIALS);

        assertThat(mapped).containsExactly(
                MappedId.malformed("1"),
                MappedId.malformed("2"),
                MappedId.of("3", "PMC3"));
        verify(api, times(1)).mapIds(eq(List.of("1", "2")), any());
    }

    @Test
    void chunksFollowConfiguredSize() {
        when(api.mapIds(any(), any())).thenReturn(Map.of());

        mapper(200, MalformedResponsePolicy.RETRY).mapIds(SUBJECT,
                java.util.stream.IntStream.range(0, 450).mapToObj(String::valueOf).toList(), CREDENTIALS);

        verify(api, times(3)).mapIds(any(), any());
    }
}
