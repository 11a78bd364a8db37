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
package se.devrandom.mimir.ncbi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Exceptions;
import se.devrandom.mimir.config.MimirProperties;
import se.devrandom.mimir.ncbi.objects.ESearchResponse;
import se.devrandom.mimir.ncbi.objects.IdConvResponse;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link LiteratureApi} backed by NCBI E-utilities: esearch for paging, the PMC id converter
 * for PMID to PMCID mapping and efetch for full-text XML.
 * Every failure is reported as an {@link UpstreamException}; retrying is up to the caller.
 * An interrupted request restores the interrupt flag and throws {@link IllegalStateException} instead.
 */
@Component
public class EutilsClient implements LiteratureApi {
    private static final Logger log = LoggerFactory.getLogger(EutilsClient.class);
    private static final int MAX_LOGGED_BODY = 300;

    private final WebClient webClient;
    private final MimirProperties properties;
    private final ArticleSplitter articleSplitter;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public EutilsClient(@Qualifier("eutilsWebClient") WebClient eutilsWebClient, MimirProperties properties) {
        this.webClient = eutilsWebClient;
        this.properties = properties;
        this.articleSplitter = new ArticleSplitter();
    }

    @Override
    public List<String> searchPage(String term, int offset, int pageSize, Credential credential) {
        URI uri = withCredential(UriComponentsBuilder.fromHttpUrl(properties.getSearch().getUrl())
                .queryParam("db", properties.getSearch().getDatabase())
                .queryParam("term", term)
                .queryParam("retmode", "json")
                .queryParam("retmax", pageSize)
                .queryParam("retstart", offset), credential);

        String body = get(uri, null, "esearch");
        ESearchResponse response = parse(body, ESearchResponse.class, "esearch");
        if (response == null || response.esearchresult == null) {
            throw new MalformedResponseException("esearch response has no esearchresult: " + abbreviate(body));
        }
        if (response.esearchresult.error != null && !response.esearchresult.error.isBlank()) {
            throw new UpstreamException("esearch reported an error: " + response.esearchresult.error);
        }
        if (response.esearchresult.idlist == null) {
            return List.of();
        }

        List<String> ids = new ArrayList<>(response.esearchresult.idlist.size());
        for (String id : response.esearchresult.idlist) {
            if (id != null && !id.isBlank()) {
                ids.add(id.trim());
            }
        }
        return ids;
    }

    @Override
    public Map<String, String> mapIds(List<String> ids, Credential credential) {
        URI uri = withCredential(UriComponentsBuilder.fromHttpUrl(properties.getMapping().getUrl())
                .queryParam("format", "json")
                .queryParam("ids", String.join(",", ids)), credential);

        String userAgent = properties.getTool() + "/1.0 (mailto:" + credential.identity() + ")";
        String body = get(uri, userAgent, "idconv");
        IdConvResponse response = parse(body, IdConvResponse.class, "idconv");
        if (response == null || response.records == null) {
            throw new MalformedResponseException("idconv response has no records (status: "
                    + (response == null ? null : response.status) + "): " + abbreviate(body));
        }

        Map<String, String> mapping = new HashMap<>();
        for (IdConvResponse.IdConvRecord record : response.records) {
            if (record == null || record.pmid == null || record.pmcid == null || record.pmcid.isBlank()) {
                continue;
            }
            mapping.put(record.pmid.trim(), record.pmcid.trim());
        }
        return mapping;
    }

    @Override
    public List<String> fetchDocuments(List<String> ids, Credential credential) {
        URI uri = withCredential(UriComponentsBuilder.fromHttpUrl(properties.getDownload().getUrl())
                .queryParam("db", properties.getDownload().getDatabase())
                .queryParam("id", String.join(",", ids))
                .queryParam("retmode", "xml"), credential);

        String body = get(uri, null, "efetch");
        return articleSplitter.split(body);
    }

    private URI withCredential(UriComponentsBuilder builder, Credential credential) {
        return builder
                .queryParam("tool", properties.getTool())
                .queryParam("email", credential.identity())
                .queryParam("api_key", credential.apiKey())
                .build()
                .encode()
                .toUri();
    }

    private String get(URI uri, String userAgent, String operation) {
        try {
            String body = webClient
                    .get()
                    .uri(uri)
                    .headers(headers -> {
                        if (userAgent != null) {
                            headers.set(HttpHeaders.USER_AGENT, userAgent);
                        }
                    })
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            if (body == null || body.isBlank()) {
                throw new MalformedResponseException(operation + " returned an empty body");
            }
            return body;
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            throw new UpstreamException(operation + " returned HTTP " + status + ": "
                    + abbreviate(e.getResponseBodyAsString()), status, e);
        } catch (WebClientRequestException e) {
            // the request URI carries the api key, so only the root cause goes into the message
            throw new UpstreamException(operation + " request failed: " + e.getMostSpecificCause().getMessage(), e);
        } catch (UpstreamException e) {
            throw e;
        } catch (RuntimeException e) {
            if (causedByInterrupt(e)) {
                // block() clears the flag before rethrowing
                Thread.currentThread().interrupt();
                throw new IllegalStateException(operation + " interrupted", e);
            }
            throw new UpstreamException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private static boolean causedByInterrupt(Throwable e) {
        for (Throwable cause = Exceptions.unwrap(e); cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    private <T> T parse(String body, Class<T> type, String operation) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            log.warn("{} returned a body that is not valid JSON: {}", operation, abbreviate(body));
            throw new MalformedResponseException(operation + " response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_LOGGED_BODY ? body : body.substring(0, MAX_LOGGED_BODY) + "...";
    }
}
