package ch.so.arp.workbench.pipeline;

import java.util.List;

/**
 * Decides whether a pipeline run supplements retrieval with web search.
 * Stateless and free of side effects.
 */
public class FallbackDecisionEngine {

    /**
     * @return {@code true} iff web fallback was requested, the web tool is
     *         available, and retrieval found nothing or nothing scoring at
     *         least {@code minScore}
     */
    public boolean decide(List<SourceSnippet> retrieved, double topScore, boolean useWebRequested,
            boolean webToolAvailable, double minScore) {
        if (!useWebRequested || !webToolAvailable) {
            return false;
        }
        return retrieved == null || retrieved.isEmpty() || topScore < minScore;
    }
}
