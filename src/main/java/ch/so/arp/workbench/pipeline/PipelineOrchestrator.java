package ch.so.arp.workbench.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.workbench.client.ChatMessage;
import ch.so.arp.workbench.client.LlmClient;
import ch.so.arp.workbench.client.VectorHit;
import ch.so.arp.workbench.client.VectorSearchClient;
import ch.so.arp.workbench.client.WebSearchClient;
import ch.so.arp.workbench.client.WebSearchResult;
import ch.so.arp.workbench.resilience.ResilientCaller;
import ch.so.arp.workbench.resilience.UpstreamServiceException;

/**
 * Runs the fixed chat pipeline: normalize, retrieve, decide, optional web
 * search, generate and format. Stages execute strictly in that order on the
 * calling thread. Every external capability is invoked through the
 * {@link ResilientCaller}; an {@link UpstreamServiceException} aborts the run
 * and propagates unchanged, discarding the partial state.
 */
public class PipelineOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);

    public static final String VECTOR_SEARCH_SERVICE = "vector-search";
    public static final String WEB_SEARCH_SERVICE = "web-search";
    public static final String LLM_SERVICE = "llm";

    private static final String UNKNOWN_ORIGIN = "unknown";

    private final VectorSearchClient vectorSearchClient;
    private final WebSearchClient webSearchClient;
    private final LlmClient llmClient;
    private final ResilientCaller resilientCaller;
    private final RequestNormalizer normalizer;
    private final FallbackDecisionEngine decisionEngine;
    private final PromptBuilder promptBuilder;

    public PipelineOrchestrator(VectorSearchClient vectorSearchClient, WebSearchClient webSearchClient,
            LlmClient llmClient, ResilientCaller resilientCaller, RequestNormalizer normalizer,
            FallbackDecisionEngine decisionEngine, PromptBuilder promptBuilder) {
        this.vectorSearchClient = Objects.requireNonNull(vectorSearchClient, "vectorSearchClient");
        this.webSearchClient = Objects.requireNonNull(webSearchClient, "webSearchClient");
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.resilientCaller = Objects.requireNonNull(resilientCaller, "resilientCaller");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.decisionEngine = Objects.requireNonNull(decisionEngine, "decisionEngine");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder");
    }

    /**
     * Executes one run. The returned state carries every stage duration except
     * the total, which the caller measures around this method.
     *
     * @throws InvalidRequestException  when the normalized request is out of range
     * @throws UpstreamServiceException when a capability fails permanently or
     *                                  after exhausting its retries
     */
    public PipelineState run(PipelineRequest request) {
        PipelineState state = normalize(request);
        retrieve(state);
        boolean useWeb = decide(state);
        if (useWeb) {
            webSearch(state);
        }
        generate(state);
        format(state);
        return state;
    }

    private PipelineState normalize(PipelineRequest request) {
        PipelineRequest normalized = normalizer.normalize(request);
        PipelineState state = new PipelineState(normalized, webSearchClient.isAvailable());
        LOGGER.info("Chat pipeline input normalised namespace='{}' top_k={} min_score={} use_web_fallback={} "
                + "max_web_results={} web_available={} history={}", normalized.namespace(), normalized.topK(),
                normalized.minScore(), normalized.useWebFallback(), normalized.maxWebResults(),
                state.isWebToolAvailable(), normalized.chatHistory().size());
        return state;
    }

    private void retrieve(PipelineState state) {
        PipelineRequest request = state.getRequest();
        long start = System.nanoTime();
        List<VectorHit> hits = resilientCaller.call(VECTOR_SEARCH_SERVICE,
                () -> vectorSearchClient.search(request.namespace(), request.query(), request.topK(), null));
        state.setRetrieveMs(elapsedMillis(start));

        List<SourceSnippet> snippets = new ArrayList<>(hits.size());
        double topScore = 0.0d;
        for (VectorHit hit : hits) {
            snippets.add(new SourceSnippet(hit.field("source", UNKNOWN_ORIGIN), hit.field("title", ""),
                    hit.field("url", ""), hit.score(), hit.field(VectorHit.TEXT_FIELD, "")));
            topScore = Math.max(topScore, hit.score());
        }
        state.setRetrieved(snippets, topScore);
        LOGGER.info("Retrieval completed namespace='{}' top_k={} hits={} top_score={}", request.namespace(),
                request.topK(), snippets.size(), String.format("%.4f", topScore));
    }

    private boolean decide(PipelineState state) {
        PipelineRequest request = state.getRequest();
        boolean useWeb = decisionEngine.decide(state.getRetrieved(), state.getTopScore(), request.useWebFallback(),
                state.isWebToolAvailable(), request.minScore());
        state.setWebFallbackUsed(useWeb);
        LOGGER.info("Routing decision use_web={} web_available={} retrieved={} top_score={} min_score={}", useWeb,
                state.isWebToolAvailable(), state.getRetrieved().size(), String.format("%.4f", state.getTopScore()),
                request.minScore());
        return useWeb;
    }

    private void webSearch(PipelineState state) {
        PipelineRequest request = state.getRequest();
        if (!webSearchClient.isAvailable()) {
            LOGGER.warn("Web search unavailable; continuing without web results");
            state.setWebResults(List.of());
            return;
        }
        long start = System.nanoTime();
        List<WebSearchResult> results = resilientCaller.call(WEB_SEARCH_SERVICE,
                () -> webSearchClient.search(request.query(), request.maxWebResults()));
        state.setWebMs(elapsedMillis(start));

        List<SourceSnippet> snippets = new ArrayList<>(results.size());
        for (WebSearchResult result : results) {
            String url = result.url() != null ? result.url() : "";
            String title = result.title() != null && !result.title().isEmpty() ? result.title() : url;
            snippets.add(SourceSnippet.web(title, url, result.content() != null ? result.content() : ""));
        }
        state.setWebResults(snippets);
        LOGGER.info("Web search completed results={} elapsed_ms={}", snippets.size(),
                String.format("%.2f", state.getTimings().webMs()));
    }

    private void generate(PipelineState state) {
        PipelineRequest request = state.getRequest();
        List<ChatMessage> messages = promptBuilder.buildMessages(request.chatHistory(), request.query(),
                state.getSources());
        long start = System.nanoTime();
        String answer = resilientCaller.call(LLM_SERVICE, () -> llmClient.generate(messages));
        state.setGenerateMs(elapsedMillis(start));
        state.setAnswer(answer);
        LOGGER.info("Answer generation completed elapsed_ms={}",
                String.format("%.2f", state.getTimings().generateMs()));
    }

    // placeholder for post-processing such as re-ranking
    private void format(PipelineState state) {
    }

    static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0d;
    }
}
