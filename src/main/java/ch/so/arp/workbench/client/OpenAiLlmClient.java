package ch.so.arp.workbench.client;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import ch.so.arp.workbench.resilience.ConfigurationException;

/**
 * {@link LlmClient} talking to an OpenAI compatible {@code /chat/completions}
 * endpoint such as Groq. Used when the application runs against real
 * infrastructure.
 */
class OpenAiLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private final OpenAiClientProperties properties;
    private final RestClient restClient;

    OpenAiLlmClient(OpenAiClientProperties properties, RestClient.Builder restClientBuilder) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new ConfigurationException(
                    "Property 'rag.chat.openai.api-key' (or GROQ_API_KEY) must be provided when mocks are disabled");
        }
        this.properties = properties;
        this.restClient = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        LOGGER.info("Using chat completion API at {} with model {} (API key {})", properties.getBaseUrl(),
                properties.getModel(), mask(properties.getApiKey()));
    }

    @Override
    public String generate(List<ChatMessage> messages) {
        Objects.requireNonNull(messages, "messages");
        CompletionRequest request = new CompletionRequest(properties.getModel(), properties.getTemperature(),
                messages.stream().map(message -> new CompletionMessage(message.role().value(), message.content()))
                        .toList());
        LOGGER.debug("Requesting completion with model {} for {} messages", properties.getModel(), messages.size());

        CompletionResponse response = restClient.post()
                .uri("/chat/completions")
                .body(request)
                .retrieve()
                .body(CompletionResponse.class);

        if (response == null || response.choices() == null || response.choices().isEmpty()
                || response.choices().get(0).message() == null) {
            throw new RestClientException("Chat completion response did not contain a message");
        }
        String content = response.choices().get(0).message().content();
        return content != null ? content : "";
    }

    private String mask(String apiKey) {
        if (apiKey == null || apiKey.length() < 4) {
            return "***";
        }
        return "***" + apiKey.substring(apiKey.length() - 4);
    }

    record CompletionRequest(String model, double temperature, List<CompletionMessage> messages) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CompletionMessage(String role, String content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CompletionResponse(List<Choice> choices) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(CompletionMessage message) {
    }
}
