package ch.so.arp.workbench.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.springframework.util.StringUtils;

import ch.so.arp.workbench.client.ChatMessage;
import ch.so.arp.workbench.client.MessageRole;

/**
 * Fills unset request fields from {@link PipelineProperties} and rejects
 * values that are out of range. Normalizing an already normalized request
 * returns an equal request.
 */
public class RequestNormalizer {

    private final PipelineProperties properties;

    public RequestNormalizer(PipelineProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    public PipelineRequest normalize(PipelineRequest request) {
        Objects.requireNonNull(request, "request");
        if (!StringUtils.hasText(request.query())) {
            throw new InvalidRequestException("query must not be blank");
        }
        String namespace = StringUtils.hasText(request.namespace()) ? request.namespace()
                : properties.getDefaultNamespace();
        int topK = request.topK() != null ? request.topK() : properties.getDefaultTopK();
        double minScore = request.minScore() != null ? request.minScore() : properties.getMinScore();
        int maxWebResults = request.maxWebResults() != null ? request.maxWebResults()
                : properties.getDefaultMaxWebResults();

        if (topK < 1 || topK > properties.getMaxTopK()) {
            throw new InvalidRequestException(
                    "top_k must be between 1 and " + properties.getMaxTopK() + " but was " + topK);
        }
        if (Double.isNaN(minScore) || minScore < 0.0d || minScore > 1.0d) {
            throw new InvalidRequestException("min_score must be between 0 and 1 but was " + minScore);
        }
        if (maxWebResults < 1 || maxWebResults > properties.getMaxWebResultsCap()) {
            throw new InvalidRequestException("max_web_results must be between 1 and "
                    + properties.getMaxWebResultsCap() + " but was " + maxWebResults);
        }

        return new PipelineRequest(request.query(), namespace, topK, minScore, request.useWebFallback(),
                maxWebResults, normalizeHistory(request.chatHistory()));
    }

    private List<ChatMessage> normalizeHistory(List<ChatMessage> history) {
        List<ChatMessage> normalized = new ArrayList<>(history.size());
        for (ChatMessage message : history) {
            if (message == null || message.content() == null || message.content().isEmpty()) {
                continue;
            }
            MessageRole role = message.role() == MessageRole.ASSISTANT ? MessageRole.ASSISTANT : MessageRole.USER;
            normalized.add(new ChatMessage(role, message.content()));
        }
        return normalized;
    }
}
