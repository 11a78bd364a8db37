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

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Stores each document as {@code <prefix><identifier>.<extension>} in an S3 bucket.
 * PutObject replaces existing objects, so storing an identifier twice leaves one object.
 */
public class S3ResultSink implements ResultSink {
    private static final Logger log = LoggerFactory.getLogger(S3ResultSink.class);

    private final S3Client s3Client;
    private final String bucketName;
    private final String prefix;
    private final String extension;

    public S3ResultSink(String bucketName, String prefix, String region, String extension) {
        this(S3Client.builder()
                        .region(Region.of(region))
                        .credentialsProvider(DefaultCredentialsProvider.create())
                        .overrideConfiguration(ClientOverrideConfiguration.builder()
                                .apiCallTimeout(Duration.ofMinutes(2))
                                .apiCallAttemptTimeout(Duration.ofMinutes(1))
                                .retryPolicy(RetryPolicy.builder()
                                        .numRetries(2)
                                        .build())
                                .build())
                        .build(),
                bucketName, prefix, extension);
        log.info("S3 sink initialized with bucket: {} in region: {} (2min timeout, 2 retries)", bucketName, region);
    }

    public S3ResultSink(S3Client s3Client, String bucketName, String prefix, String extension) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        this.prefix = prefix == null ? "" : prefix;
        this.extension = extension;
    }

    @Override
    public StoreResult store(String identifier, String content) {
        String key = keyFor(identifier);
        try {
            Map<String, String> metadata = new HashMap<>();
            metadata.put("source-id", identifier);
            metadata.put("upload-date", LocalDateTime.now().toString());

            PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                    .bucket(bucketName)
                    .key(key)
                    .contentType(contentType())
                    .metadata(metadata)
                    .build();

            s3Client.putObject(putObjectRequest, RequestBody.fromString(content, StandardCharsets.UTF_8));
            log.debug("Uploaded {} to s3://{}/{}", identifier, bucketName, key);
            return StoreResult.success("s3://" + bucketName + "/" + key);
        } catch (Exception e) {
            log.error("Failed to upload {} to s3://{}/{}: {}", identifier, bucketName, key, e.getMessage());
            return StoreResult.failure("S3 upload failed: " + e.getMessage());
        }
    }

    String keyFor(String identifier) {
        return prefix + identifier + "." + extension;
    }

    private String contentType() {
        return switch (extension.toLowerCase()) {
            case "xml" -> "application/xml";
            case "json" -> "application/json";
            case "txt" -> "text/plain";
            default -> "application/octet-stream";
        };
    }

    @Override
    public String describe() {
        return "s3://" + bucketName + "/" + prefix;
    }

    @PreDestroy
    public void close() {
        s3Client.close();
    }
}
