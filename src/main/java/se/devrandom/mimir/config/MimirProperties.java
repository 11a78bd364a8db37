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
package se.devrandom.mimir.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import se.devrandom.mimir.harvest.MalformedResponsePolicy;
import se.devrandom.mimir.ncbi.CredentialSelection;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "mimir")
public class MimirProperties {
    private List<String> subjects = new ArrayList<>();
    private String tool = "Mimir";
    private List<CredentialEntry> credentials = new ArrayList<>();
    private CredentialSelection credentialSelection = CredentialSelection.PER_REQUEST;
    private int credentialRotateEvery = 4;

    private Duration retryDelay = Duration.ofSeconds(60);
    private Duration retryJitter = Duration.ZERO;
    private Duration requestDelay = Duration.ofMillis(400);
    private int subjectConcurrency = 4;
    private Duration subjectCooldown = Duration.ofSeconds(5);

    private final Search search = new Search();
    private final Mapping mapping = new Mapping();
    private final Download download = new Download();
    private final Sink sink = new Sink();
    private final Report report = new Report();
    private final Http http = new Http();

    /**
     * Fails fast on settings that would make the pipeline stall or misbehave.
     * Credential contents are checked by the credential pool itself.
     */
    @PostConstruct
    public void validate() {
        requirePositive("mimir.search.page-size", search.pageSize);
        requirePositive("mimir.search.max-offset", search.maxOffset);
        requirePositive("mimir.mapping.chunk-size", mapping.chunkSize);
        requirePositive("mimir.download.chunk-size", download.chunkSize);
        requirePositive("mimir.download.concurrency", download.concurrency);
        requirePositive("mimir.download.max-attempts", download.maxAttempts);
        requirePositive("mimir.subject-concurrency", subjectConcurrency);
        requirePositive("mimir.credential-rotate-every", credentialRotateEvery);
        requireNotNegative("mimir.retry-delay", retryDelay);
        requireNotNegative("mimir.retry-jitter", retryJitter);
        requireNotNegative("mimir.request-delay", requestDelay);
        requireNotNegative("mimir.subject-cooldown", subjectCooldown);
        if (download.chunkTimeout == null || download.chunkTimeout.isZero() || download.chunkTimeout.isNegative()) {
            throw new ConfigException("mimir.download.chunk-timeout must be positive");
        }
        if (credentials == null || credentials.isEmpty()) {
            throw new ConfigException("mimir.credentials must contain at least one identity/api-key pair");
        }
        if (sink.type == SinkType.S3 && (sink.s3.bucket == null || sink.s3.bucket.isBlank())) {
            throw new ConfigException("mimir.sink.s3.bucket is required when mimir.sink.type=s3");
        }
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new ConfigException(name + " must be at least 1, was " + value);
        }
    }

    private static void requireNotNegative(String name, Duration value) {
        if (value == null || value.isNegative()) {
            throw new ConfigException(name + " must be zero or positive");
        }
    }

    public List<String> getSubjects() {
        return subjects;
    }

    public void setSubjects(List<String> subjects) {
        this.subjects = subjects;
    }

    public String getTool() {
        return tool;
    }

    public void setTool(String tool) {
        this.tool = tool;
    }

    public List<CredentialEntry> getCredentials() {
        return credentials;
    }

    public void setCredentials(List<CredentialEntry> credentials) {
        this.credentials = credentials;
    }

    public CredentialSelection getCredentialSelection() {
        return credentialSelection;
    }

    public void setCredentialSelection(CredentialSelection credentialSelection) {
        this.credentialSelection = credentialSelection;
    }

    public int getCredentialRotateEvery() {
        return credentialRotateEvery;
    }

    public void setCredentialRotateEvery(int credentialRotateEvery) {
        this.credentialRotateEvery = credentialRotateEvery;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
        this.retryDelay = retryDelay;
    }

    public Duration getRetryJitter() {
        return retryJitter;
    }

    public void setRetryJitter(Duration retryJitter) {
        this.retryJitter = retryJitter;
    }

    public Duration getRequestDelay() {
        return requestDelay;
    }

    public void setRequestDelay(Duration requestDelay) {
        this.requestDelay = requestDelay;
    }

    public int getSubjectConcurrency() {
        return subjectConcurrency;
    }

    public void setSubjectConcurrency(int subjectConcurrency) {
        this.subjectConcurrency = subjectConcurrency;
    }

    public Duration getSubjectCooldown() {
        return subjectCooldown;
    }

    public void setSubjectCooldown(Duration subjectCooldown) {
        this.subjectCooldown = subjectCooldown;
    }

    public Search getSearch() {
        return search;
    }

    public Mapping getMapping() {
        return mapping;
    }

    public Download getDownload() {
        return download;
    }

    public Sink getSink() {
        return sink;
    }

    public Report getReport() {
        return report;
    }

    public Http getHttp() {
        return http;
    }

    public static class CredentialEntry {
        private String identity;
        private String apiKey;

        public CredentialEntry() {
        }

        public CredentialEntry(String identity, String apiKey) {
            this.identity = identity;
            this.apiKey = apiKey;
        }

        public String getIdentity() {
            return identity;
        }

        public void setIdentity(String identity) {
            this.identity = identity;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }

    public static class Search {
        private String url = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils/esearch.fcgi";
        private String database = "pubmed";
        private int pageSize = 10000;
        // esearch refuses retstart values beyond this
        private int maxOffset = 9999;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public int getMaxOffset() {
            return maxOffset;
        }

        public void setMaxOffset(int maxOffset) {
            this.maxOffset = maxOffset;
        }
    }

    public static class Mapping {
        private boolean enabled = true;
        private String url = "https://www.ncbi.nlm.nih.gov/pmc/utils/idconv/v1.0/";
        private int chunkSize = 200;
        private MalformedResponsePolicy malformedResponsePolicy = MalformedResponsePolicy.RETRY;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public MalformedResponsePolicy getMalformedResponsePolicy() {
            return malformedResponsePolicy;
        }

        public void setMalformedResponsePolicy(MalformedResponsePolicy malformedResponsePolicy) {
            this.malformedResponsePolicy = malformedResponsePolicy;
        }
    }

    public static class Download {
        private String url = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils/efetch.fcgi";
        private String database = "pmc";
        private int chunkSize = 100;
        private int concurrency = 4;
        private int maxAttempts = 3;
        private Duration chunkTimeout = Duration.ofMinutes(10);

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getChunkTimeout() {
            return chunkTimeout;
        }

        public void setChunkTimeout(Duration chunkTimeout) {
            this.chunkTimeout = chunkTimeout;
        }
    }

    public enum SinkType {
        LOCAL,
        S3
    }

    public static class Sink {
        private SinkType type = SinkType.LOCAL;
        private String extension = "xml";
        private final Local local = new Local();
        private final S3 s3 = new S3();

        public SinkType getType() {
            return type;
        }

        public void setType(SinkType type) {
            this.type = type;
        }

        public String getExtension() {
            return extension;
        }

        public void setExtension(String extension) {
            this.extension = extension;
        }

        public Local getLocal() {
            return local;
        }

        public S3 getS3() {
            return s3;
        }

        public static class Local {
            private String directory = "data/documents";

            public String getDirectory() {
                return directory;
            }

            public void setDirectory(String directory) {
                this.directory = directory;
            }
        }

        public static class S3 {
            private String bucket;
            private String prefix = "pmc_xml/";
            private String region = "eu-north-1";

            public String getBucket() {
                return bucket;
            }

            public void setBucket(String bucket) {
                this.bucket = bucket;
            }

            public String getPrefix() {
                return prefix;
            }

            public void setPrefix(String prefix) {
                this.prefix = prefix;
            }

            public String getRegion() {
                return region;
            }

            public void setRegion(String region) {
                this.region = region;
            }
        }
    }

    public static class Report {
        private String directory = "reports";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration responseTimeout = Duration.ofSeconds(60);
        private int maxInMemoryMb = 64;

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getResponseTimeout() {
            return responseTimeout;
        }

        public void setResponseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
        }

        public int getMaxInMemoryMb() {
            return maxInMemoryMb;
        }

        public void setMaxInMemoryMb(int maxInMemoryMb) {
            this.maxInMemoryMb = maxInMemoryMb;
        }
    }
}
