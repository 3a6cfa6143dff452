package ch.so.arp.workbench.client;

import java.util.List;
import java.util.Map;

/**
 * Lightweight replacement for the real vector index. It deterministically
 * mirrors the query so that the application runs without external services.
 */
class MockVectorSearchClient implements VectorSearchClient {

    private static final double MOCK_SCORE = 0.5d;

    @Override
    public List<VectorHit> search(String namespace, String queryText, int topK, Map<String, Object> filters) {
        return List.of(new VectorHit("mock-0", MOCK_SCORE, Map.of(
                VectorHit.TEXT_FIELD, "Mock context for: " + queryText,
                "title", "Mock heading",
                "source", "mock-" + namespace,
                "url", "")));
    }
}
