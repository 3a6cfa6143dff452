package ch.so.arp.workbench.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import ch.so.arp.workbench.cache.CacheStats;
import ch.so.arp.workbench.client.VectorHit;
import ch.so.arp.workbench.metrics.MetricsSnapshot;
import ch.so.arp.workbench.metrics.TimingStatistics;
import ch.so.arp.workbench.pipeline.PipelineRequest;
import ch.so.arp.workbench.pipeline.SourceSnippet;
import ch.so.arp.workbench.pipeline.StageTimings;
import ch.so.arp.workbench.resilience.UpstreamServiceException;

class ChatControllerTest {

    private static final ChatResponse RESPONSE = new ChatResponse("Zoning applies [1]",
            List.of(new SourceSnippet("docs", "Zoning plan", "", 0.8d, "text")), new StageTimings(1, 0, 2, 3), false,
            0.8d);

    private ChatService chatService;
    private SearchService searchService;
    private RecordingSseEmitter emitter;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        chatService = mock(ChatService.class);
        searchService = mock(SearchService.class);
        emitter = new RecordingSseEmitter();
        ChatController controller = new ChatController(chatService, searchService, () -> emitter);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void answersChatRequestAsynchronously() throws Exception {
        when(chatService.submitChat(any())).thenReturn(CompletableFuture.completedFuture(RESPONSE));

        MvcResult result = mockMvc.perform(post("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"What is zoning?\",\"top_k\":3,\"use_web_fallback\":false}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Zoning applies [1]"))
                .andExpect(jsonPath("$.web_fallback_used").value(false))
                .andExpect(jsonPath("$.top_score").value(0.8d))
                .andExpect(jsonPath("$.sources[0].source").value("docs"))
                .andExpect(jsonPath("$.sources[0].chunk_text").value("text"))
                .andExpect(jsonPath("$.timings.total_ms").value(3.0d));

        ArgumentCaptor<PipelineRequest> captor = ArgumentCaptor.forClass(PipelineRequest.class);
        verify(chatService).submitChat(captor.capture());
        assertThat(captor.getValue().topK()).isEqualTo(3);
        assertThat(captor.getValue().useWebFallback()).isFalse();
        assertThat(captor.getValue().namespace()).isNull();
    }

    @Test
    void webFallbackDefaultsToEnabled() {
        PipelineRequest request = new ChatRequest("q", null, null, null, null, null, null).toPipelineRequest();

        assertThat(request.useWebFallback()).isTrue();
    }

    @Test
    void rejectsInvalidPayloadWithUnprocessableEntity() throws Exception {
        mockMvc.perform(post("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"\",\"top_k\":500}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value(ApiExceptionHandler.VALIDATION_ERROR));

        verify(chatService, never()).submitChat(any());
    }

    @Test
    void mapsUpstreamFailureToBadGateway() throws Exception {
        when(chatService.submitChat(any())).thenReturn(CompletableFuture.failedFuture(
                new UpstreamServiceException("llm", "Upstream llm call failed. Please try again later.", 3, null)));

        MvcResult result = mockMvc.perform(post("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"What is zoning?\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value(ApiExceptionHandler.UPSTREAM_ERROR))
                .andExpect(jsonPath("$.message").value("Upstream llm call failed. Please try again later."));
    }

    @Test
    void mapsSaturatedWorkerPoolToServiceUnavailable() throws Exception {
        when(chatService.submitChat(any())).thenThrow(new RejectedExecutionException("queue full"));

        mockMvc.perform(post("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"What is zoning?\"}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void hidesDetailsOfUnexpectedFailures() throws Exception {
        when(searchService.search(any(SearchRequest.class))).thenThrow(new IllegalStateException("secret detail"));

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"zoning\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value(ApiExceptionHandler.GENERIC_MESSAGE));
    }

    @Test
    void returnsSearchHits() throws Exception {
        when(searchService.search(any(SearchRequest.class))).thenReturn(new SearchResponse("dev", "zoning", 5,
                List.of(new VectorHit("doc-1", 0.7d, Map.of(VectorHit.TEXT_FIELD, "text")))));

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"zoning\",\"filters\":{\"year\":2024}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.namespace").value("dev"))
                .andExpect(jsonPath("$.top_k").value(5))
                .andExpect(jsonPath("$.hits[0].id").value("doc-1"))
                .andExpect(jsonPath("$.hits[0].fields.chunk_text").value("text"));

        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
        verify(searchService).search(captor.capture());
        assertThat(captor.getValue().filters()).containsEntry("year", 2024);
    }

    @Test
    void exposesMetricsSnapshot() throws Exception {
        Map<String, Double> zeros = Map.of("total_ms", 0.0d);
        when(chatService.getMetricsSnapshot()).thenReturn(new MetricsSnapshot(Map.of("/chat", 2L), Map.of(),
                new TimingStatistics(zeros, zeros, zeros), Map.of("chat", new CacheStats(1, 1)), 0L, List.of()));

        mockMvc.perform(get("/api/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requests_by_path['/chat']").value(2))
                .andExpect(jsonPath("$.timings.p95_ms.total_ms").value(0.0d))
                .andExpect(jsonPath("$.cache.chat.hits").value(1));
    }

    @Test
    void streamsTokensAndFinalEventThroughSseEmitter() {
        AtomicReference<ChatService.StreamingResponseHandler> handlerReference = new AtomicReference<>();
        doAnswer(invocation -> {
            handlerReference.set(invocation.getArgument(1));
            return null;
        }).when(chatService).streamChat(any(), any());

        ChatController controller = new ChatController(chatService, searchService, () -> emitter);
        SseEmitter returned = controller.streamChat(new ChatRequest("How are you?", null, null, null, null, null,
                null));

        assertThat(returned).isSameAs(emitter);
        ChatService.StreamingResponseHandler handler = handlerReference.get();
        handler.onToken("Zoning");
        handler.onToken("applies");
        handler.onComplete(RESPONSE);

        assertThat(emitter.getEvents()).containsExactly("Zoning", "applies");
        assertThat(emitter.getNamedEvents()).hasSize(1);
        assertThat(emitter.isCompleted()).isTrue();
    }

    @Test
    void reportsErrorsFromStreamingHandler() {
        AtomicReference<ChatService.StreamingResponseHandler> handlerReference = new AtomicReference<>();
        doAnswer(invocation -> {
            handlerReference.set(invocation.getArgument(1));
            return null;
        }).when(chatService).streamChat(any(), any());

        ChatController controller = new ChatController(chatService, searchService, () -> emitter);
        controller.streamChat(new ChatRequest("broken", null, null, null, null, null, null));

        handlerReference.get().onError(new RuntimeException("secret detail"));

        assertThat(emitter.getNamedEvents()).hasSize(1);
        assertThat(emitter.getErrors()).isEmpty();
        assertThat(emitter.isCompleted()).isTrue();
    }

    @Test
    void describesStreamFailuresWithoutInternalDetails() {
        assertThat(ApiExceptionHandler.describeStreamFailure(new RuntimeException("secret detail")))
                .isEqualTo(new ApiExceptionHandler.StreamError(ApiExceptionHandler.INTERNAL_ERROR,
                        ApiExceptionHandler.GENERIC_MESSAGE, null));
        assertThat(ApiExceptionHandler.describeStreamFailure(
                new UpstreamServiceException("vector_search", "Upstream vector_search call failed.", 3, null)))
                .isEqualTo(new ApiExceptionHandler.StreamError(ApiExceptionHandler.UPSTREAM_ERROR,
                        "Upstream vector_search call failed.", "vector_search"));
    }

    private static final class RecordingSseEmitter extends SseEmitter {

        private final List<String> events = new CopyOnWriteArrayList<>();
        private final List<SseEventBuilder> namedEvents = new CopyOnWriteArrayList<>();
        private final List<Throwable> errors = new CopyOnWriteArrayList<>();
        private volatile boolean completed;

        private RecordingSseEmitter() {
            super(0L);
        }

        @Override
        public void send(Object object) throws IOException {
            events.add(String.valueOf(object));
        }

        @Override
        public void send(SseEventBuilder builder) throws IOException {
            namedEvents.add(builder);
        }

        @Override
        public void complete() {
            completed = true;
            super.complete();
        }

        @Override
        public void completeWithError(Throwable ex) {
            errors.add(ex);
            super.completeWithError(ex);
        }

        List<String> getEvents() {
            return new ArrayList<>(events);
        }

        List<SseEventBuilder> getNamedEvents() {
            return new ArrayList<>(namedEvents);
        }

        List<Throwable> getErrors() {
            return new ArrayList<>(errors);
        }

        boolean isCompleted() {
            return completed;
        }
    }
}
