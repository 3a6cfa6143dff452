package ch.so.arp.workbench.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single vector index match. The chunk text is always available under
 * {@link #TEXT_FIELD}, whatever field name the index uses internally.
 */
public record VectorHit(String id, double score, Map<String, Object> fields) {

    public static final String TEXT_FIELD = "chunk_text";

    public VectorHit {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String field(String name, String fallback) {
        Object value = fields.get(name);
        if (value == null) {
            return fallback;
        }
        String text = String.valueOf(value);
        return text.isEmpty() ? fallback : text;
    }
}
