package ch.so.arp.workbench.cache;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Fingerprint of a retrieval-only search. Filters are reduced to compact JSON
 * with keys sorted at every nesting level, so logically equal filter maps
 * produce equal keys regardless of their iteration order.
 */
public record SearchCacheKey(String namespace, String query, int topK, String filters) {

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public static SearchCacheKey of(String namespace, String query, int topK, Map<String, Object> filters) {
        return new SearchCacheKey(namespace, query, topK, canonicalize(filters));
    }

    static String canonicalize(Map<String, Object> filters) {
        if (filters == null) {
            return "";
        }
        try {
            return CANONICAL_MAPPER.writeValueAsString(filters);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Search filters are not serialisable: " + ex.getOriginalMessage(), ex);
        }
    }
}
