package ch.so.arp.workbench.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ch.so.arp.workbench.client.ChatMessage;

/**
 * Immutable input of a pipeline run. {@code null} for namespace, topK,
 * minScore or maxWebResults means "use the configured default".
 *
 * @param chatHistory prior turns, oldest first; never {@code null}
 */
public record PipelineRequest(
        String query,
        String namespace,
        Integer topK,
        Double minScore,
        boolean useWebFallback,
        Integer maxWebResults,
        List<ChatMessage> chatHistory) {

    public PipelineRequest {
        chatHistory = chatHistory == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(chatHistory));
    }

    public static PipelineRequest of(String query) {
        return new PipelineRequest(query, null, null, null, true, null, List.of());
    }

    /**
     * Only requests without conversation history may be served from or stored
     * in the chat cache.
     */
    public boolean isCacheable() {
        return chatHistory.isEmpty();
    }
}
