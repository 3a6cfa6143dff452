package ch.so.arp.workbench.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpServerErrorException;

import ch.so.arp.workbench.client.ChatMessage;
import ch.so.arp.workbench.client.LlmClient;
import ch.so.arp.workbench.client.VectorHit;
import ch.so.arp.workbench.client.VectorSearchClient;
import ch.so.arp.workbench.client.WebSearchClient;
import ch.so.arp.workbench.client.WebSearchResult;
import ch.so.arp.workbench.resilience.HttpFailureClassifier;
import ch.so.arp.workbench.resilience.ResilientCaller;
import ch.so.arp.workbench.resilience.RetryPolicy;
import ch.so.arp.workbench.resilience.UpstreamServiceException;

class PipelineOrchestratorTest {

    private VectorSearchClient vectorSearchClient;
    private WebSearchClient webSearchClient;
    private LlmClient llmClient;
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        vectorSearchClient = mock(VectorSearchClient.class);
        webSearchClient = mock(WebSearchClient.class);
        llmClient = mock(LlmClient.class);
        ResilientCaller caller = new ResilientCaller(new HttpFailureClassifier(),
                new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(4)));
        orchestrator = new PipelineOrchestrator(vectorSearchClient, webSearchClient, llmClient, caller,
                new RequestNormalizer(new PipelineProperties()), new FallbackDecisionEngine(), new PromptBuilder());
        when(llmClient.generate(anyList())).thenReturn("grounded answer [1]");
    }

    @Test
    void answersFromRetrievalWhenScoreIsHighEnough() {
        when(webSearchClient.isAvailable()).thenReturn(true);
        when(vectorSearchClient.search(eq("dev"), eq("What is zoning?"), eq(5), isNull())).thenReturn(List.of(
                hit("a", 0.9d, "Zoning plan"), hit("b", 0.4d, "Building rules")));

        PipelineState state = orchestrator.run(PipelineRequest.of("What is zoning?"));

        assertThat(state.getAnswer()).isEqualTo("grounded answer [1]");
        assertThat(state.isWebFallbackUsed()).isFalse();
        assertThat(state.getTopScore()).isEqualTo(0.9d);
        assertThat(state.getSources()).extracting(SourceSnippet::title)
                .containsExactly("Zoning plan", "Building rules");
        assertThat(state.getSources().get(0).origin()).isEqualTo("docs");
        assertThat(state.getTimings().webMs()).isZero();
        assertThat(state.getTimings().retrieveMs()).isGreaterThanOrEqualTo(0.0d);
        verify(webSearchClient, never()).search(anyString(), anyInt());
    }

    @Test
    void runsStagesInFixedOrder() {
        when(webSearchClient.isAvailable()).thenReturn(true);
        when(vectorSearchClient.search(any(), any(), anyInt(), any())).thenReturn(List.of());
        when(webSearchClient.search(any(), anyInt())).thenReturn(List.of());

        orchestrator.run(PipelineRequest.of("q"));

        InOrder order = inOrder(vectorSearchClient, webSearchClient, llmClient);
        order.verify(vectorSearchClient).search(any(), any(), anyInt(), any());
        order.verify(webSearchClient).search(any(), anyInt());
        order.verify(llmClient).generate(anyList());
    }

    @Test
    void appendsWebResultsAfterRetrievedSnippetsOnLowScore() {
        when(webSearchClient.isAvailable()).thenReturn(true);
        when(vectorSearchClient.search(any(), any(), anyInt(), any())).thenReturn(List.of(hit("a", 0.1d, "Weak")));
        when(webSearchClient.search("q", 3)).thenReturn(List.of(
                new WebSearchResult("News", "https://example.invalid/news", "fresh content"),
                new WebSearchResult(null, "https://example.invalid/untitled", null)));
        AtomicReference<List<ChatMessage>> messages = new AtomicReference<>();
        when(llmClient.generate(anyList())).thenAnswer(invocation -> {
            messages.set(invocation.getArgument(0));
            return "grounded answer [1]";
        });

        PipelineState state = orchestrator.run(new PipelineRequest("q", null, null, null, true, 3, null));

        assertThat(state.isWebFallbackUsed()).isTrue();
        assertThat(state.getTopScore()).isEqualTo(0.1d);
        assertThat(state.getSources()).extracting(SourceSnippet::origin).containsExactly("docs", "web", "web");
        assertThat(state.getWebResults()).allSatisfy(snippet -> assertThat(snippet.score()).isZero());
        assertThat(state.getWebResults().get(1).title()).isEqualTo("https://example.invalid/untitled");
        assertThat(state.getWebResults().get(1).text()).isEmpty();

        List<ChatMessage> sent = messages.get();
        assertThat(sent.get(sent.size() - 1).content())
                .contains("[1] (docs) Weak")
                .contains("[2] (web) News");
    }

    @Test
    void skipsWebSearchWhenToolIsUnavailable() {
        when(webSearchClient.isAvailable()).thenReturn(false);
        when(vectorSearchClient.search(any(), any(), anyInt(), any())).thenReturn(List.of());

        PipelineState state = orchestrator.run(PipelineRequest.of("q"));

        assertThat(state.isWebFallbackUsed()).isFalse();
        assertThat(state.getSources()).isEmpty();
        assertThat(state.getTopScore()).isZero();
        assertThat(state.getAnswer()).isEqualTo("grounded answer [1]");
        verify(webSearchClient, never()).search(anyString(), anyInt());
    }

    @Test
    void retriesTransientRetrievalFailures() {
        when(webSearchClient.isAvailable()).thenReturn(false);
        when(vectorSearchClient.search(any(), any(), anyInt(), any()))
                .thenThrow(serverError())
                .thenReturn(List.of(hit("a", 0.8d, "Recovered")));

        PipelineState state = orchestrator.run(PipelineRequest.of("q"));

        assertThat(state.getSources()).extracting(SourceSnippet::title).containsExactly("Recovered");
    }

    @Test
    void abortsRunWhenGenerationKeepsFailing() {
        when(webSearchClient.isAvailable()).thenReturn(false);
        when(vectorSearchClient.search(any(), any(), anyInt(), any())).thenReturn(List.of(hit("a", 0.8d, "Doc")));
        when(llmClient.generate(anyList())).thenThrow(serverError());

        assertThatThrownBy(() -> orchestrator.run(PipelineRequest.of("q")))
                .isInstanceOfSatisfying(UpstreamServiceException.class, ex -> {
                    assertThat(ex.getService()).isEqualTo(PipelineOrchestrator.LLM_SERVICE);
                    assertThat(ex.getAttempts()).isEqualTo(3);
                });
    }

    @Test
    void rejectsInvalidRequestBeforeCallingCapabilities() {
        assertThatThrownBy(() -> orchestrator.run(new PipelineRequest("q", null, 0, null, true, null, null)))
                .isInstanceOf(InvalidRequestException.class);
        verify(vectorSearchClient, never()).search(any(), any(), anyInt(), any());
    }

    private static VectorHit hit(String id, double score, String title) {
        return new VectorHit(id, score, Map.of(VectorHit.TEXT_FIELD, "text of " + title, "title", title,
                "source", "docs"));
    }

    private static HttpServerErrorException serverError() {
        return HttpServerErrorException.create(HttpStatus.SERVICE_UNAVAILABLE, "unavailable", HttpHeaders.EMPTY,
                new byte[0], StandardCharsets.UTF_8);
    }
}
