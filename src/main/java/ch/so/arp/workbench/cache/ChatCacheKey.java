package ch.so.arp.workbench.cache;

/**
 * Fingerprint of a full chat answer. Conversation history is not part of the
 * key; callers only cache requests without history.
 */
public record ChatCacheKey(String namespace, String query, int topK, double minScore, boolean useWebFallback) {
}
