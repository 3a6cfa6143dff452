package ch.so.arp.workbench.chat;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import ch.so.arp.workbench.cache.CacheProperties;
import ch.so.arp.workbench.cache.CacheStats;
import ch.so.arp.workbench.cache.ChatCacheKey;
import ch.so.arp.workbench.cache.ResponseCache;
import ch.so.arp.workbench.cache.SearchCacheKey;
import ch.so.arp.workbench.client.LlmClient;
import ch.so.arp.workbench.client.VectorHit;
import ch.so.arp.workbench.client.VectorSearchClient;
import ch.so.arp.workbench.client.WebSearchClient;
import ch.so.arp.workbench.metrics.MetricsAggregator;
import ch.so.arp.workbench.pipeline.FallbackDecisionEngine;
import ch.so.arp.workbench.pipeline.PipelineOrchestrator;
import ch.so.arp.workbench.pipeline.PipelineProperties;
import ch.so.arp.workbench.pipeline.PromptBuilder;
import ch.so.arp.workbench.pipeline.RequestNormalizer;
import ch.so.arp.workbench.resilience.HttpFailureClassifier;
import ch.so.arp.workbench.resilience.ResilienceProperties;
import ch.so.arp.workbench.resilience.ResilientCaller;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Central configuration wiring the pipeline, the caches, the metrics and the
 * chat worker pool together. Capability clients come from
 * {@link ch.so.arp.workbench.client.ClientConfiguration}.
 */
@Configuration
@EnableConfigurationProperties({ PipelineProperties.class, CacheProperties.class })
public class ChatConfiguration {

    public static final String SEARCH_CACHE = "search";
    public static final String CHAT_CACHE = "chat";

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "chatExecutor")
    public ThreadPoolExecutor chatExecutor(PipelineProperties properties) {
        int threads = properties.getWorkerThreads();
        return new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(properties.getQueueCapacity()), new ChatThreadFactory(),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResponseCache<SearchCacheKey, List<VectorHit>> searchCache(CacheProperties properties, Clock clock) {
        return new ResponseCache<>(SEARCH_CACHE, properties.isEnabled(), properties.getTtl(),
                properties.getSearchCapacity(), clock);
    }

    @Bean
    public ResponseCache<ChatCacheKey, ChatResponse> chatCache(CacheProperties properties, Clock clock) {
        return new ResponseCache<>(CHAT_CACHE, properties.isEnabled(), properties.getTtl(),
                properties.getChatCapacity(), clock);
    }

    @Bean
    public MetricsAggregator metricsAggregator(ResponseCache<SearchCacheKey, List<VectorHit>> searchCache,
            ResponseCache<ChatCacheKey, ChatResponse> chatCache, ObjectProvider<MeterRegistry> meterRegistry) {
        return new MetricsAggregator(MetricsAggregator.DEFAULT_BUFFER_SIZE, () -> {
            Map<String, CacheStats> stats = new LinkedHashMap<>();
            stats.put(SEARCH_CACHE, searchCache.stats());
            stats.put(CHAT_CACHE, chatCache.stats());
            return stats;
        }, meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ResilientCaller resilientCaller(ResilienceProperties properties) {
        return new ResilientCaller(new HttpFailureClassifier(), properties.toRetryPolicy());
    }

    @Bean
    public RequestNormalizer requestNormalizer(PipelineProperties properties) {
        return new RequestNormalizer(properties);
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(VectorSearchClient vectorSearchClient,
            WebSearchClient webSearchClient, LlmClient llmClient, ResilientCaller resilientCaller,
            RequestNormalizer requestNormalizer) {
        return new PipelineOrchestrator(vectorSearchClient, webSearchClient, llmClient, resilientCaller,
                requestNormalizer, new FallbackDecisionEngine(), new PromptBuilder());
    }

    @Bean
    public ChatService chatService(PipelineOrchestrator orchestrator, RequestNormalizer requestNormalizer,
            ResponseCache<ChatCacheKey, ChatResponse> chatCache, MetricsAggregator metricsAggregator,
            @Qualifier("chatExecutor") Executor chatExecutor) {
        return new ChatService(orchestrator, requestNormalizer, chatCache, metricsAggregator, chatExecutor);
    }

    @Bean
    public SearchService searchService(VectorSearchClient vectorSearchClient, ResilientCaller resilientCaller,
            ResponseCache<SearchCacheKey, List<VectorHit>> searchCache, MetricsAggregator metricsAggregator,
            PipelineProperties properties) {
        return new SearchService(vectorSearchClient, resilientCaller, searchCache, metricsAggregator, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public SseEmitterFactory sseEmitterFactory(PipelineProperties properties) {
        return new DefaultSseEmitterFactory(properties.getStreamTimeout());
    }

    private static final class ChatThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "chat-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
