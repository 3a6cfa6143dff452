package ch.so.arp.workbench.chat;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.workbench.cache.ChatCacheKey;
import ch.so.arp.workbench.cache.ResponseCache;
import ch.so.arp.workbench.metrics.MetricsAggregator;
import ch.so.arp.workbench.metrics.MetricsSnapshot;
import ch.so.arp.workbench.pipeline.PipelineOrchestrator;
import ch.so.arp.workbench.pipeline.PipelineRequest;
import ch.so.arp.workbench.pipeline.PipelineState;
import ch.so.arp.workbench.pipeline.RequestNormalizer;

/**
 * Entry point for chat requests. Serves history-free requests from the chat
 * cache when possible, otherwise runs the {@link PipelineOrchestrator},
 * measures the total duration and records request counters and timing
 * samples. Failed runs are counted as errors and neither cached nor sampled.
 */
public class ChatService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatService.class);

    public static final String CHAT_PATH = "/chat";
    public static final String STREAM_PATH = "/chat/stream";

    private final PipelineOrchestrator orchestrator;
    private final RequestNormalizer normalizer;
    private final ResponseCache<ChatCacheKey, ChatResponse> chatCache;
    private final MetricsAggregator metrics;
    private final Executor chatExecutor;

    public ChatService(PipelineOrchestrator orchestrator, RequestNormalizer normalizer,
            ResponseCache<ChatCacheKey, ChatResponse> chatCache, MetricsAggregator metrics, Executor chatExecutor) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.chatCache = Objects.requireNonNull(chatCache, "chatCache");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.chatExecutor = Objects.requireNonNull(chatExecutor, "chatExecutor");
    }

    /**
     * Answers the request on the calling thread.
     */
    public ChatResponse runChat(PipelineRequest request) {
        return execute(request, CHAT_PATH, true);
    }

    /**
     * Answers the request on the bounded chat worker pool.
     *
     * @throws java.util.concurrent.RejectedExecutionException when the pool
     *         and its queue are saturated
     */
    public CompletableFuture<ChatResponse> submitChat(PipelineRequest request) {
        try {
            return CompletableFuture.supplyAsync(() -> runChat(request), chatExecutor);
        } catch (RejectedExecutionException ex) {
            metrics.recordRequest(CHAT_PATH, true);
            throw ex;
        }
    }

    /**
     * Runs the full pipeline on the worker pool, then hands the answer to the
     * handler as whitespace separated tokens followed by the complete
     * response. Streaming bypasses the chat cache.
     */
    public void streamChat(PipelineRequest request, StreamingResponseHandler handler) {
        Objects.requireNonNull(handler, "handler");
        try {
            chatExecutor.execute(() -> stream(request, handler));
        } catch (RejectedExecutionException ex) {
            metrics.recordRequest(STREAM_PATH, true);
            throw ex;
        }
    }

    private void stream(PipelineRequest request, StreamingResponseHandler handler) {
        ChatResponse response;
        try {
            response = execute(request, STREAM_PATH, false);
        } catch (Exception ex) {
            LOGGER.error("Failed to produce streamed response for query '{}': {}", request.query(),
                    ex.getMessage(), ex);
            handler.onError(ex);
            return;
        }
        for (String token : response.answer().split("\\s+")) {
            if (!token.isEmpty()) {
                handler.onToken(token);
            }
        }
        handler.onComplete(response);
    }

    public MetricsSnapshot getMetricsSnapshot() {
        return metrics.snapshot();
    }

    private ChatResponse execute(PipelineRequest request, String path, boolean useCache) {
        boolean failed = true;
        try {
            // any submitted history, even blank turns, opts out of caching
            boolean cacheable = useCache && request.isCacheable();
            PipelineRequest normalized = normalizer.normalize(request);
            ChatCacheKey cacheKey = cacheable ? cacheKey(normalized) : null;
            if (cacheable) {
                Optional<ChatResponse> cached = chatCache.get(cacheKey);
                if (cached.isPresent()) {
                    LOGGER.info("Serving {} response from cache namespace='{}' query='{}'", path,
                            normalized.namespace(), normalized.query());
                    // replays the timings of the run that produced the entry
                    metrics.recordTiming(cached.get().toTimingSample());
                    failed = false;
                    return cached.get();
                }
            }

            long start = System.nanoTime();
            PipelineState state = orchestrator.run(normalized);
            state.setTotalMs((System.nanoTime() - start) / 1_000_000.0d);
            ChatResponse response = ChatResponse.from(state);

            LOGGER.info("Chat request completed path={} namespace='{}' web_fallback_used={} retrieve_ms={} web_ms={} "
                    + "generate_ms={} total_ms={} top_score={}", path, normalized.namespace(),
                    response.webFallbackUsed(), format(response.timings().retrieveMs()),
                    format(response.timings().webMs()), format(response.timings().generateMs()),
                    format(response.timings().totalMs()), String.format("%.4f", response.topScore()));

            metrics.recordTiming(response.toTimingSample());
            if (cacheable) {
                chatCache.put(cacheKey, response);
            }
            failed = false;
            return response;
        } finally {
            metrics.recordRequest(path, failed);
        }
    }

    private static ChatCacheKey cacheKey(PipelineRequest normalized) {
        return new ChatCacheKey(normalized.namespace(), normalized.query(), normalized.topK(),
                normalized.minScore(), normalized.useWebFallback());
    }

    private static String format(double millis) {
        return String.format("%.2f", millis);
    }

    /**
     * Callback API allowing to react to the streaming behaviour of the service.
     */
    public interface StreamingResponseHandler {

        void onToken(String token);

        void onComplete(ChatResponse response);

        void onError(Throwable throwable);
    }
}
