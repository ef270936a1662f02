package com.careerpath.orchestrator.provider.search;

import com.careerpath.orchestrator.provider.ProviderException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * {@link SearchService} over the Tavily search API.
 *
 * Queries are cut to 300 characters; a 400 on a long query is retried once
 * with the first 200. Without an API key every search returns an empty list.
 */
@Component
public class TavilySearchService implements SearchService {

    private static final Logger log = LoggerFactory.getLogger(TavilySearchService.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(List<SearchResult> results) {}

    static final String PROVIDER = "search";

    private static final int MAX_QUERY_LENGTH   = 300;
    private static final int SHORT_QUERY_LENGTH = 200;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final Retry        retry;
    private final String       apiKey;
    private final String       baseUrl;
    private final String       searchDepth;
    private final Duration     timeout;

    public TavilySearchService(@Value("${careerpath.search.api-key:}") String apiKey,
                               @Value("${careerpath.search.base-url}") String baseUrl,
                               @Value("${careerpath.search.depth:basic}") String searchDepth,
                               @Value("${careerpath.search.timeout:15s}") Duration timeout,
                               ObjectMapper objectMapper,
                               RetryRegistry retryRegistry) {
        this.apiKey      = apiKey;
        this.baseUrl     = baseUrl;
        this.searchDepth = searchDepth;
        this.timeout     = timeout;
        this.json        = objectMapper;
        this.retry       = retryRegistry.retry(PROVIDER);
        this.http        = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.retry.getEventPublisher().onRetry(e -> log.warn("Search attempt {} failed, retrying in {}: {}",
                e.getNumberOfRetryAttempts(), e.getWaitInterval(),
                e.getLastThrowable() == null ? "?" : e.getLastThrowable().getMessage()));
    }

    @Override
    public List<SearchResult> search(String query, int maxResults) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Search API key is not configured, returning no results for '{}'", query);
            return List.of();
        }
        String q = query.length() > MAX_QUERY_LENGTH ? query.substring(0, MAX_QUERY_LENGTH) : query;
        try {
            return Retry.decorateSupplier(retry, () -> send(q, maxResults)).get();
        } catch (ProviderException e) {
            if (e.statusCode() != 400 || q.length() <= SHORT_QUERY_LENGTH) {
                throw e;
            }
            log.warn("Search rejected a {}-character query, retrying with {}", q.length(), SHORT_QUERY_LENGTH);
            String shorter = q.substring(0, SHORT_QUERY_LENGTH);
            return Retry.decorateSupplier(retry, () -> send(shorter, maxResults)).get();
        }
    }

    private List<SearchResult> send(String query, int maxResults) {
        try {
            String body = json.writeValueAsString(Map.of(
                    "query",        query,
                    "search_depth", searchDepth,
                    "max_results",  maxResults
            ));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/search"))
                    .timeout(timeout)
                    .header("Content-Type",  "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new ProviderException(PROVIDER, response.statusCode(), response.body());
            }
            SearchResponse parsed = json.readValue(response.body(), SearchResponse.class);
            if (parsed.results() == null) {
                log.warn("Search returned no results field for '{}'", query);
                return List.of();
            }
            return parsed.results();
        } catch (ProviderException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw new ProviderException(PROVIDER, ProviderException.NO_STATUS, "unreadable response", e);
        } catch (IOException e) {
            throw new ProviderException(PROVIDER, ProviderException.IO_ERROR, e.toString(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(PROVIDER, ProviderException.NO_STATUS, "interrupted", e);
        }
    }
}
