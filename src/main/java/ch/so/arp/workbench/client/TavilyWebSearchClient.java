package ch.so.arp.workbench.client;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tavily backed {@link WebSearchClient}. Reports itself unavailable when no
 * API key is configured instead of failing.
 */
class TavilyWebSearchClient implements WebSearchClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(TavilyWebSearchClient.class);

    private final TavilyProperties properties;
    private final RestClient restClient;
    private final boolean available;

    TavilyWebSearchClient(TavilyProperties properties, RestClient.Builder restClientBuilder) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.available = StringUtils.hasText(properties.getApiKey());
        RestClient.Builder builder = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (available) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey());
        } else {
            LOGGER.warn("TAVILY_API_KEY is not set. Web fallback is disabled.");
        }
        this.restClient = builder.build();
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public List<WebSearchResult> search(String query, int maxResults) {
        if (!available) {
            return List.of();
        }
        LOGGER.debug("Searching Tavily max_results={} depth={}", maxResults, properties.getSearchDepth());
        SearchResponse response = restClient.post()
                .uri("/search")
                .body(new SearchRequest(query, maxResults, properties.getSearchDepth(), false))
                .retrieve()
                .body(SearchResponse.class);

        if (response == null || response.results() == null) {
            return List.of();
        }
        return response.results().stream()
                .filter(Objects::nonNull)
                .map(result -> new WebSearchResult(result.title(), result.url(), result.content()))
                .toList();
    }

    record SearchRequest(String query, @JsonProperty("max_results") int maxResults,
            @JsonProperty("search_depth") String searchDepth, @JsonProperty("include_answer") boolean includeAnswer) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(List<Result> results) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Result(String title, String url, String content) {
    }
}
