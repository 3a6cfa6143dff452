package ch.so.arp.workbench.client;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import ch.so.arp.workbench.resilience.ConfigurationException;

class ClientConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(ClientConfiguration.class);

    @Test
    void usesMocksByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(LlmClient.class);
            assertThat(context).getBean(LlmClient.class).isInstanceOf(MockLlmClient.class);
            assertThat(context).hasSingleBean(VectorSearchClient.class);
            assertThat(context).getBean(VectorSearchClient.class).isInstanceOf(MockVectorSearchClient.class);
            assertThat(context).hasSingleBean(WebSearchClient.class);
        });
    }

    @Test
    void createsRealBeansWhenMocksDisabled() {
        contextRunner
                .withPropertyValues(
                        "rag.chat.mock-llm=false",
                        "rag.chat.mock-vector-store=false",
                        "rag.chat.openai.api-key=test-key",
                        "rag.chat.openai.base-url=https://example.com/v1",
                        "rag.chat.openai.model=llama-3.3-70b-versatile",
                        "rag.pinecone.api-key=pc-key",
                        "rag.pinecone.host=https://index.example.com",
                        "rag.web.tavily.api-key=tv-key")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).getBean(LlmClient.class).isInstanceOf(OpenAiLlmClient.class);
                    OpenAiClientProperties properties = context.getBean(OpenAiClientProperties.class);
                    assertThat(properties.getApiKey()).isEqualTo("test-key");
                    assertThat(properties.getModel()).isEqualTo("llama-3.3-70b-versatile");

                    assertThat(context).getBean(VectorSearchClient.class)
                            .isInstanceOf(PineconeVectorSearchClient.class);
                    assertThat(context.getBean(WebSearchClient.class).isAvailable()).isTrue();
                });
    }

    @Test
    void openAiKeyFallsBackToGroqEnvironmentVariable() {
        contextRunner
                .withPropertyValues("GROQ_API_KEY=from-env")
                .run(context -> assertThat(context.getBean(OpenAiClientProperties.class).getApiKey())
                        .isEqualTo("from-env"));
    }

    @Test
    void refusesToStartWithoutCredentialsWhenMocksDisabled() {
        contextRunner
                .withPropertyValues("rag.chat.mock-vector-store=false")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure()
                        .hasRootCauseInstanceOf(ConfigurationException.class));
    }

    @Test
    void webSearchIsUnavailableWithoutKey() {
        contextRunner
                .withPropertyValues("rag.web.tavily.api-key=")
                .run(context -> assertThat(context.getBean(WebSearchClient.class).isAvailable()).isFalse());
    }
}
