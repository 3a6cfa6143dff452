package ch.so.arp.workbench.chat;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import ch.so.arp.workbench.metrics.MetricsSnapshot;
import jakarta.validation.Valid;

/**
 * REST endpoints for chat, streamed chat, retrieval-only search and the
 * metrics snapshot.
 */
@RestController
@RequestMapping(path = "/api")
@Validated
public class ChatController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatController.class);

    static final String END_EVENT = "end";
    static final String ERROR_EVENT = "error";

    private final ChatService chatService;
    private final SearchService searchService;
    private final SseEmitterFactory emitterFactory;

    public ChatController(ChatService chatService, SearchService searchService, SseEmitterFactory emitterFactory) {
        this.chatService = chatService;
        this.searchService = searchService;
        this.emitterFactory = emitterFactory;
    }

    @PostMapping(path = "/chat", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public CompletableFuture<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        return chatService.submitChat(request.toPipelineRequest());
    }

    @PostMapping(path = "/chat/stream", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamChat(@Valid @RequestBody ChatRequest request) {
        SseEmitter emitter = emitterFactory.create();
        chatService.streamChat(request.toPipelineRequest(), new ChatService.StreamingResponseHandler() {
            @Override
            public void onToken(String token) {
                try {
                    emitter.send(token);
                } catch (IOException ex) {
                    LOGGER.warn("Unable to stream token: {}", token, ex);
                    emitter.completeWithError(ex);
                }
            }

            @Override
            public void onComplete(ChatResponse response) {
                try {
                    emitter.send(SseEmitter.event().name(END_EVENT).data(response, MediaType.APPLICATION_JSON));
                    emitter.complete();
                } catch (IOException ex) {
                    LOGGER.warn("Unable to send final chat event", ex);
                    emitter.completeWithError(ex);
                }
            }

            @Override
            public void onError(Throwable throwable) {
                // the response is already committed as text/event-stream
                ApiExceptionHandler.StreamError error = ApiExceptionHandler.describeStreamFailure(throwable);
                try {
                    emitter.send(SseEmitter.event().name(ERROR_EVENT).data(error, MediaType.APPLICATION_JSON));
                    emitter.complete();
                } catch (IOException ex) {
                    LOGGER.warn("Unable to send error event {}", error.code(), ex);
                    emitter.completeWithError(ex);
                }
            }
        });
        return emitter;
    }

    @PostMapping(path = "/search", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public SearchResponse search(@Valid @RequestBody SearchRequest request) {
        return searchService.search(request);
    }

    @GetMapping(path = "/metrics", produces = MediaType.APPLICATION_JSON_VALUE)
    public MetricsSnapshot metrics() {
        return chatService.getMetricsSnapshot();
    }
}
