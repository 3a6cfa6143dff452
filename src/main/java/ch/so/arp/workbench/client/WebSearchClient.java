package ch.so.arp.workbench.client;

import java.util.List;

/**
 * Optional live web search capability.
 */
public interface WebSearchClient {

    /**
     * @return {@code false} when the capability is not configured; callers then
     *         treat a search as yielding no results
     */
    boolean isAvailable();

    List<WebSearchResult> search(String query, int maxResults);
}
