package ch.so.arp.workbench.client;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Settings of the Tavily web search integration. Without an API key the web
 * search capability is reported as unavailable.
 */
@ConfigurationProperties(prefix = "rag.web.tavily")
public class TavilyProperties implements EnvironmentAware {

    /**
     * API key. Falls back to the {@code TAVILY_API_KEY} environment variable.
     */
    private String apiKey;

    private String baseUrl = "https://api.tavily.com";

    /**
     * Either {@code basic} or {@code advanced}.
     */
    private String searchDepth = "basic";

    private Environment environment;

    public String getApiKey() {
        if (StringUtils.hasText(apiKey)) {
            return apiKey;
        }
        return environment != null ? environment.getProperty("TAVILY_API_KEY") : null;
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

    public String getSearchDepth() {
        return searchDepth;
    }

    public void setSearchDepth(String searchDepth) {
        this.searchDepth = searchDepth;
    }

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }
}
