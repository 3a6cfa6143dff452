package ch.so.arp.workbench.client;

import java.util.List;
import java.util.Map;

/**
 * Minimal vector index abstraction. Embedding of the query text happens on the
 * index side.
 */
public interface VectorSearchClient {

    /**
     * Find the chunks most similar to the query text.
     *
     * @param namespace the index partition to search
     * @param queryText the natural language query
     * @param topK      the maximum amount of hits to return
     * @param filters   optional metadata filter, {@code null} for none
     * @return hits ordered by descending score
     */
    List<VectorHit> search(String namespace, String queryText, int topK, Map<String, Object> filters);
}
