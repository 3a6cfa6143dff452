package ch.so.arp.workbench.client;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Configuration properties describing how to reach an OpenAI compatible chat
 * completion API. Defaults target Groq.
 */
@ConfigurationProperties(prefix = "rag.chat.openai")
public class OpenAiClientProperties implements EnvironmentAware {

    /**
     * API key that authorises requests. Falls back to the {@code GROQ_API_KEY}
     * environment variable.
     */
    private String apiKey;

    /**
     * Base URL for the API. Defaults to Groq's OpenAI compatible endpoint.
     */
    private String baseUrl = "https://api.groq.com/openai/v1";

    /**
     * Name of the chat model that should be used.
     */
    private String model = "llama-3.1-8b-instant";

    /**
     * Sampling temperature passed with every completion request.
     */
    private double temperature = 0.2d;

    private Environment environment;

    public String getApiKey() {
        if (StringUtils.hasText(apiKey)) {
            return apiKey;
        }
        return environment != null ? environment.getProperty("GROQ_API_KEY") : null;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }
}
