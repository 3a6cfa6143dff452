package ch.so.arp.workbench.chat;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import ch.so.arp.workbench.cache.ResponseCache;
import ch.so.arp.workbench.cache.SearchCacheKey;
import ch.so.arp.workbench.client.VectorHit;
import ch.so.arp.workbench.client.VectorSearchClient;
import ch.so.arp.workbench.metrics.MetricsAggregator;
import ch.so.arp.workbench.pipeline.InvalidRequestException;
import ch.so.arp.workbench.pipeline.PipelineOrchestrator;
import ch.so.arp.workbench.pipeline.PipelineProperties;
import ch.so.arp.workbench.resilience.ResilientCaller;

/**
 * Retrieval-only access to the vector index, backed by the search cache.
 */
public class SearchService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SearchService.class);

    public static final String SEARCH_PATH = "/search";

    private final VectorSearchClient vectorSearchClient;
    private final ResilientCaller resilientCaller;
    private final ResponseCache<SearchCacheKey, List<VectorHit>> searchCache;
    private final MetricsAggregator metrics;
    private final PipelineProperties properties;

    public SearchService(VectorSearchClient vectorSearchClient, ResilientCaller resilientCaller,
            ResponseCache<SearchCacheKey, List<VectorHit>> searchCache, MetricsAggregator metrics,
            PipelineProperties properties) {
        this.vectorSearchClient = Objects.requireNonNull(vectorSearchClient, "vectorSearchClient");
        this.resilientCaller = Objects.requireNonNull(resilientCaller, "resilientCaller");
        this.searchCache = Objects.requireNonNull(searchCache, "searchCache");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    public SearchResponse search(SearchRequest request) {
        return search(request.namespace(), request.query(), request.topK(), request.filters());
    }

    /**
     * Searches the index, serving repeated identical queries from the cache.
     *
     * @param namespace index namespace, the configured default when blank
     * @param topK number of hits, the configured default when {@code null}
     * @param filters optional metadata filter, may be {@code null}
     */
    public SearchResponse search(String namespace, String query, Integer topK, Map<String, Object> filters) {
        boolean failed = true;
        try {
            if (!StringUtils.hasText(query)) {
                throw new InvalidRequestException("query must not be blank");
            }
            String effectiveNamespace = StringUtils.hasText(namespace) ? namespace.trim()
                    : properties.getDefaultNamespace();
            int effectiveTopK = topK != null ? topK : properties.getDefaultTopK();
            if (effectiveTopK < 1 || effectiveTopK > properties.getMaxTopK()) {
                throw new InvalidRequestException(
                        "top_k must be between 1 and " + properties.getMaxTopK() + " but was " + effectiveTopK);
            }
            String trimmedQuery = query.trim();

            SearchCacheKey key = SearchCacheKey.of(effectiveNamespace, trimmedQuery, effectiveTopK, filters);
            Optional<List<VectorHit>> cached = searchCache.get(key);
            List<VectorHit> hits;
            if (cached.isPresent()) {
                hits = cached.get();
                LOGGER.debug("Search cache hit namespace='{}' query='{}'", effectiveNamespace, trimmedQuery);
            } else {
                hits = List.copyOf(resilientCaller.call(PipelineOrchestrator.VECTOR_SEARCH_SERVICE,
                        () -> vectorSearchClient.search(effectiveNamespace, trimmedQuery, effectiveTopK, filters)));
                searchCache.put(key, hits);
                LOGGER.info("Search namespace='{}' top_k={} returned {} hits", effectiveNamespace, effectiveTopK,
                        hits.size());
            }
            failed = false;
            return new SearchResponse(effectiveNamespace, trimmedQuery, effectiveTopK, hits);
        } finally {
            metrics.recordRequest(SEARCH_PATH, failed);
        }
    }
}
