package ch.so.arp.workbench.client;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import ch.so.arp.workbench.resilience.ConfigurationException;

/**
 * {@link VectorSearchClient} backed by a Pinecone integrated embedding index.
 * Uses the records search endpoint so the query text is embedded by Pinecone.
 * The configured text field is returned as {@link VectorHit#TEXT_FIELD}.
 */
class PineconeVectorSearchClient implements VectorSearchClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(PineconeVectorSearchClient.class);

    private static final List<String> METADATA_FIELDS = List.of("title", "source", "url", "published", "doc_id",
            "chunk_id");

    private final RestClient restClient;
    private final String textField;

    PineconeVectorSearchClient(PineconeProperties properties, RestClient.Builder restClientBuilder) {
        if (!StringUtils.hasText(properties.getApiKey()) || !StringUtils.hasText(properties.getHost())) {
            throw new ConfigurationException(
                    "Properties 'rag.pinecone.api-key' and 'rag.pinecone.host' must be provided when mocks are disabled");
        }
        if (!StringUtils.hasText(properties.getTextField())) {
            throw new ConfigurationException("Property 'rag.pinecone.text-field' must not be empty");
        }
        this.textField = properties.getTextField().trim();
        this.restClient = restClientBuilder
                .baseUrl(properties.getHost())
                .defaultHeader("Api-Key", properties.getApiKey())
                .defaultHeader("X-Pinecone-API-Version", properties.getApiVersion())
                .build();
        LOGGER.info("Using Pinecone index at {} (text field '{}')", properties.getHost(), textField);
    }

    @Override
    public List<VectorHit> search(String namespace, String queryText, int topK, Map<String, Object> filters) {
        Objects.requireNonNull(namespace, "namespace");
        List<String> fields = new ArrayList<>(METADATA_FIELDS);
        fields.add(0, textField);
        SearchRequest request = new SearchRequest(
                new Query(Map.of("text", queryText), topK, filters == null || filters.isEmpty() ? null : filters),
                fields);
        LOGGER.debug("Searching Pinecone namespace='{}' top_k={} filters={}", namespace, topK, filters);

        SearchResponse response = restClient.post()
                .uri("/records/namespaces/{namespace}/search", namespace)
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(SearchResponse.class);

        if (response == null || response.result() == null || response.result().hits() == null) {
            return List.of();
        }
        return response.result().hits().stream().map(this::toVectorHit).toList();
    }

    private VectorHit toVectorHit(Hit hit) {
        Map<String, Object> fields = new LinkedHashMap<>(hit.fields() != null ? hit.fields() : Map.of());
        Object text = fields.remove(textField);
        fields.put(VectorHit.TEXT_FIELD, text != null ? text : "");
        return new VectorHit(hit.id(), hit.score(), fields);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Query(Map<String, String> inputs, @JsonProperty("top_k") int topK, Map<String, Object> filter) {
    }

    record SearchRequest(Query query, List<String> fields) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(Result result) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Result(List<Hit> hits) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Hit(@JsonProperty("_id") String id, @JsonProperty("_score") double score, Map<String, Object> fields) {
    }
}
