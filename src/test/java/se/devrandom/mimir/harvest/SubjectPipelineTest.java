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
import se.devrandom.mimir.ncbi.CredentialSource;
import se.devrandom.mimir.storage.ResultSink;

import java.time.Duration;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubjectPipelineTest {

    private static final CredentialPool CREDENTIALS = new CredentialPool(List.of(new Credential("a@example.org", "key-a")));
    private static final Subject SUBJECT = new Subject("GENE", 0);

    @Mock
    private PaginatedSearchFetcher searchFetcher;
    @Mock
    private BatchIdMapper idMapper;
    @Mock
    private ConcurrentBatchDownloader downloader;
    @Mock
    private ResultSink sink;

    private SubjectPipeline pipeline(boolean mappingEnabled) {
        return new SubjectPipeline(searchFetcher, idMapper, downloader, sink, CREDENTIALS, mappingEnabled, Duration.ZERO);
    }

    private void searchReturns(List<String> ids, boolean truncated) {
        when(searchFetcher.search(eq(SUBJECT), any(CredentialSource.class), any(BooleanSupplier.class)))
                .thenReturn(new SearchResult(ids, truncated, false, 1));
    }

    @Test
    @DisplayName("Zero search results skip mapping and download entirely")
    void zeroResultsShortCircuit() {
        searchReturns(List.of(), false);

        SubjectReport report = pipeline(true).run(SUBJECT);

        assertThat(report.status()).isEqualTo(SubjectReport.Status.NO_RESULTS);
        assertThat(report.outcomes()).isEmpty();
        verifyNoInteractions(idMapper, downloader, sink);
    }

    @Test
    @DisplayName("With mapping enabled only mapped ids are downloaded, by their secondary id")
    void downloadsMappedIdsOnly() {
        searchReturns(List.of("1", "2", "1", "3"), true);
        when(idMapper.mapIds(eq(SUBJECT), eq(List.of("1", "2", "3")), any()))
                .thenReturn(List.of(MappedId.of("1", "PMC1"), MappedId.of("2", null), MappedId.of("3", "PMC3")));
        when(downloader.download(eq(SUBJECT), eq(List.of("PMC1", "PMC3")), eq(sink), any(), any()))
                .thenReturn(List.of(FetchOutcome.persisted("PMC1"), FetchOutcome.persisted("PMC3")));

        SubjectReport report = pipeline(true).run(SUBJECT);

        assertThat(report.status()).isEqualTo(SubjectReport.Status.COMPLETED);
        assertThat(report.truncated()).isTrue();
        assertThat(report.primaryCount()).isEqualTo(3);
        assertThat(report.mappedCount()).isEqualTo(2);
        assertThat(report.unmappedCount()).isEqualTo(1);
        assertThat(report.persistedCount()).isEqualTo(2);
    }

    @Test
    void downloadsPrimaryIdsWhenMappingDisabled() {
        searchReturns(List.of("1", "2"), false);
        when(downloader.download(eq(SUBJECT), eq(List.of("1", "2")), eq(sink), any(), any()))
                .thenReturn(List.of(FetchOutcome.persisted("1"),
                        FetchOutcome.failed("2", FetchOutcome.FailureKind.SINK, "disk full")));

        SubjectReport report = pipeline(false).run(SUBJECT);

        assertThat(report.status()).isEqualTo(SubjectReport.Status.COMPLETED_WITH_ERRORS);
        assertThat(report.mappings()).isEmpty();
        assertThat(report.failedCount()).isEqualTo(1);
        verifyNoInteractions(idMapper);
    }

    @Test
    @DisplayName("An unexpected error becomes a FAILED report instead of escaping")
    void unexpectedErrorIsReported() {
        searchReturns(List.of("1"), false);
        when(downloader.download(any(), anyList(), any(), any(), any()))
                .thenThrow(new IllegalStateException("worker pool gone"));

        SubjectReport report = pipeline(false).run(SUBJECT);

        assertThat(report.status()).isEqualTo(SubjectReport.Status.FAILED);
        assertThat(report.error()).isEqualTo("worker pool gone");
    }

    @Test
    @DisplayName("Cancelling an in-flight subject ends it as CANCELLED")
    void cancelInFlightSubject() {
        SubjectPipeline pipeline = pipeline(true);
        when(searchFetcher.search(eq(SUBJECT), any(CredentialSource.class), any(BooleanSupplier.class)))
                .thenAnswer(invocation -> {
                    BooleanSupplier cancelled = invocation.getArgument(2);
                    assertThat(pipeline.cancel("GENE")).isTrue();
                    return new SearchResult(List.of("1"), false, cancelled.getAsBoolean(), 1);
                });

        SubjectReport report = pipeline.run(SUBJECT);

        assertThat(report.status()).isEqualTo(SubjectReport.Status.CANCELLED);
        verifyNoInteractions(idMapper, downloader);
    }

    @Test
    void cancelUnknownSubjectIsRejected() {
        assertThat(pipeline(true).cancel("NOT-RUNNING")).isFalse();
    }

    @Test
    void cancelFlagIsPassedToDownloader() {
        searchReturns(List.of("1"), false);
        when(downloader.download(eq(SUBJECT), eq(List.of("1")), eq(sink), any(), any()))
                .thenReturn(List.of(FetchOutcome.persisted("1")));

        pipeline(false).run(SUBJECT);

        verify(downloader).download(eq(SUBJECT), eq(List.of("1")), eq(sink), any(CredentialSource.class),
                any(BooleanSupplier.class));
    }
}
