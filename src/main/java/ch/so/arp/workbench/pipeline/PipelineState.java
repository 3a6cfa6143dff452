package ch.so.arp.workbench.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Working record threaded through the stages of one pipeline run. Owned by
 * exactly one run and never shared between threads.
 * <p>
 * The normalized request is fixed at construction. Retrieval fills
 * {@link #getRetrieved()} and {@link #getTopScore()}, the decision sets
 * {@link #isWebFallbackUsed()}, web search fills {@link #getWebResults()} and
 * generation sets {@link #getAnswer()}. Each stage records its own duration;
 * the total is set by the caller.
 */
public final class PipelineState {

    /**
     * Incremented whenever fields are added or change meaning.
     */
    public static final int SCHEMA_VERSION = 1;

    private final PipelineRequest request;
    private final boolean webToolAvailable;
    private final List<SourceSnippet> retrieved = new ArrayList<>();
    private final List<SourceSnippet> webResults = new ArrayList<>();
    private double topScore;
    private boolean webFallbackUsed;
    private String answer = "";
    private double retrieveMs;
    private double webMs;
    private double generateMs;
    private double totalMs;

    PipelineState(PipelineRequest request, boolean webToolAvailable) {
        this.request = Objects.requireNonNull(request, "request");
        this.webToolAvailable = webToolAvailable;
    }

    public int getSchemaVersion() {
        return SCHEMA_VERSION;
    }

    /**
     * @return the request with all defaults applied
     */
    public PipelineRequest getRequest() {
        return request;
    }

    public boolean isWebToolAvailable() {
        return webToolAvailable;
    }

    public List<SourceSnippet> getRetrieved() {
        return List.copyOf(retrieved);
    }

    void setRetrieved(List<SourceSnippet> snippets, double topScore) {
        retrieved.clear();
        retrieved.addAll(snippets);
        this.topScore = topScore;
    }

    public List<SourceSnippet> getWebResults() {
        return List.copyOf(webResults);
    }

    void setWebResults(List<SourceSnippet> snippets) {
        webResults.clear();
        webResults.addAll(snippets);
    }

    /**
     * @return retrieved snippets followed by web snippets
     */
    public List<SourceSnippet> getSources() {
        List<SourceSnippet> sources = new ArrayList<>(retrieved.size() + webResults.size());
        sources.addAll(retrieved);
        sources.addAll(webResults);
        return List.copyOf(sources);
    }

    public double getTopScore() {
        return topScore;
    }

    public boolean isWebFallbackUsed() {
        return webFallbackUsed;
    }

    void setWebFallbackUsed(boolean webFallbackUsed) {
        this.webFallbackUsed = webFallbackUsed;
    }

    public String getAnswer() {
        return answer;
    }

    void setAnswer(String answer) {
        this.answer = answer != null ? answer : "";
    }

    void setRetrieveMs(double retrieveMs) {
        this.retrieveMs = retrieveMs;
    }

    void setWebMs(double webMs) {
        this.webMs = webMs;
    }

    void setGenerateMs(double generateMs) {
        this.generateMs = generateMs;
    }

    /**
     * Injects the end-to-end duration measured around the run.
     */
    public void setTotalMs(double totalMs) {
        this.totalMs = totalMs;
    }

    public StageTimings getTimings() {
        return new StageTimings(retrieveMs, webMs, generateMs, totalMs);
    }
}
