package ch.so.arp.workbench.client;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import ch.so.arp.workbench.resilience.ResilienceProperties;

/**
 * Wires the external capability clients. The toggles decide whether mocked or
 * real infrastructure components are used.
 */
@Configuration
@EnableConfigurationProperties({ OpenAiClientProperties.class, PineconeProperties.class, TavilyProperties.class,
        ResilienceProperties.class })
public class ClientConfiguration {

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-llm", havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient() {
        return new MockLlmClient();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-llm", havingValue = "false")
    public LlmClient openAiLlmClient(OpenAiClientProperties properties, ResilienceProperties resilience,
            ObjectProvider<RestClient.Builder> restClientBuilder) {
        return new OpenAiLlmClient(properties, builder(restClientBuilder, resilience));
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-vector-store", havingValue = "true", matchIfMissing = true)
    public VectorSearchClient mockVectorSearchClient() {
        return new MockVectorSearchClient();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-vector-store", havingValue = "false")
    public VectorSearchClient pineconeVectorSearchClient(PineconeProperties properties,
            ResilienceProperties resilience, ObjectProvider<RestClient.Builder> restClientBuilder) {
        return new PineconeVectorSearchClient(properties, builder(restClientBuilder, resilience));
    }

    @Bean
    @ConditionalOnMissingBean
    public WebSearchClient tavilyWebSearchClient(TavilyProperties properties, ResilienceProperties resilience,
            ObjectProvider<RestClient.Builder> restClientBuilder) {
        return new TavilyWebSearchClient(properties, builder(restClientBuilder, resilience));
    }

    private static RestClient.Builder builder(ObjectProvider<RestClient.Builder> restClientBuilder,
            ResilienceProperties resilience) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMillis = (int) resilience.getTimeout().toMillis();
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);
        return restClientBuilder.getIfAvailable(RestClient::builder).requestFactory(requestFactory);
    }
}
