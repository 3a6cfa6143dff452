package ch.so.arp.workbench.pipeline;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults and limits applied when a chat request leaves a field unset, plus
 * the sizing of the worker pool that executes pipeline runs.
 */
@ConfigurationProperties(prefix = "rag.pipeline")
public class PipelineProperties {

    /**
     * Vector index namespace used when the request names none.
     */
    private String defaultNamespace = "dev";

    private int defaultTopK = 5;

    private int maxTopK = 100;

    /**
     * Top retrieval score below which web fallback is considered.
     */
    private double minScore = 0.25d;

    private int defaultMaxWebResults = 5;

    private int maxWebResultsCap = 20;

    /**
     * Threads executing pipeline runs concurrently.
     */
    private int workerThreads = 8;

    /**
     * Runs waiting for a free worker before new submissions are rejected.
     */
    private int queueCapacity = 64;

    /**
     * Lifetime of a streamed chat connection. Zero disables the timeout.
     */
    private Duration streamTimeout = Duration.ZERO;

    public String getDefaultNamespace() {
        return defaultNamespace;
    }

    public void setDefaultNamespace(String defaultNamespace) {
        this.defaultNamespace = defaultNamespace;
    }

    public int getDefaultTopK() {
        return defaultTopK;
    }

    public void setDefaultTopK(int defaultTopK) {
        this.defaultTopK = defaultTopK;
    }

    public int getMaxTopK() {
        return maxTopK;
    }

    public void setMaxTopK(int maxTopK) {
        this.maxTopK = maxTopK;
    }

    public double getMinScore() {
        return minScore;
    }

    public void setMinScore(double minScore) {
        this.minScore = minScore;
    }

    public int getDefaultMaxWebResults() {
        return defaultMaxWebResults;
    }

    public void setDefaultMaxWebResults(int defaultMaxWebResults) {
        this.defaultMaxWebResults = defaultMaxWebResults;
    }

    public int getMaxWebResultsCap() {
        return maxWebResultsCap;
    }

    public void setMaxWebResultsCap(int maxWebResultsCap) {
        this.maxWebResultsCap = maxWebResultsCap;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public Duration getStreamTimeout() {
        return streamTimeout;
    }

    public void setStreamTimeout(Duration streamTimeout) {
        this.streamTimeout = streamTimeout;
    }
}
