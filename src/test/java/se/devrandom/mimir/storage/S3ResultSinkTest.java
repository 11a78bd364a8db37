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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class S3ResultSinkTest {

    @Mock
    private S3Client s3Client;

    @Test
    @DisplayName("Uploads to prefix + id + extension with XML content type and source metadata")
    void putsObjectUnderPrefixedKey() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().build());
        S3ResultSink sink = new S3ResultSink(s3Client, "harvest-bucket", "pmc_xml/", "xml");

        StoreResult result = sink.store("PMC123", "<article/>");

        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(request.capture(), any(RequestBody.class));
        assertThat(request.getValue().bucket()).isEqualTo("harvest-bucket");
        assertThat(request.getValue().key()).isEqualTo("pmc_xml/PMC123.xml");
        assertThat(request.getValue().contentType()).isEqualTo("application/xml");
        assertThat(request.getValue().metadata()).containsEntry("source-id", "PMC123").containsKey("upload-date");
        assertThat(result.success()).isTrue();
        assertThat(result.location()).isEqualTo("s3://harvest-bucket/pmc_xml/PMC123.xml");
    }

    @Test
    @DisplayName("A failed upload comes back as a failure result")
    void uploadFailureIsReported() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("Unable to execute HTTP request"));
        S3ResultSink sink = new S3ResultSink(s3Client, "harvest-bucket", "pmc_xml/", "xml");

        StoreResult result = sink.store("PMC123", "<article/>");

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("Unable to execute HTTP request");
    }

    @Test
    void describesBucketAndPrefix() {
        assertThat(new S3ResultSink(s3Client, "b", "p/", "xml").describe()).isEqualTo("s3://b/p/");
    }
}
