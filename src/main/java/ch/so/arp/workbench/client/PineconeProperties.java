package ch.so.arp.workbench.client;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings of the Pinecone index. The index must use integrated
 * inference so that query embeddings are computed server side.
 */
@ConfigurationProperties(prefix = "rag.pinecone")
public class PineconeProperties {

    private String apiKey;

    /**
     * Data plane host of the index, e.g. {@code https://my-index-abc123.svc.pinecone.io}.
     */
    private String host;

    /**
     * Record field holding the chunk text, as mapped in the index field map.
     */
    private String textField = VectorHit.TEXT_FIELD;

    private String apiVersion = "2025-01";

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public String getTextField() {
        return textField;
    }

    public void setTextField(String textField) {
        this.textField = textField;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }
}
