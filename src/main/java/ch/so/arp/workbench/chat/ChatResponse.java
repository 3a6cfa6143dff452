package ch.so.arp.workbench.chat;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import ch.so.arp.workbench.metrics.TimingSample;
import ch.so.arp.workbench.pipeline.PipelineState;
import ch.so.arp.workbench.pipeline.SourceSnippet;
import ch.so.arp.workbench.pipeline.StageTimings;

/**
 * Result of a chat request: the answer, every snippet used as context and the
 * stage timings of the run that produced it.
 */
public record ChatResponse(
        String answer,
        List<SourceSnippet> sources,
        StageTimings timings,
        @JsonProperty("web_fallback_used") boolean webFallbackUsed,
        @JsonProperty("top_score") double topScore) {

    public ChatResponse {
        sources = List.copyOf(sources);
    }

    static ChatResponse from(PipelineState state) {
        return new ChatResponse(state.getAnswer(), state.getSources(), state.getTimings(),
                state.isWebFallbackUsed(), state.getTopScore());
    }

    TimingSample toTimingSample() {
        return new TimingSample(timings.retrieveMs(), timings.webMs(), timings.generateMs(), timings.totalMs());
    }
}
