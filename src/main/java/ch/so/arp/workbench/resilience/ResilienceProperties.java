package ch.so.arp.workbench.resilience;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry and timeout settings shared by all outbound capability calls.
 */
@ConfigurationProperties(prefix = "rag.resilience")
public class ResilienceProperties {

    /**
     * Maximum number of invocations, the first one included.
     */
    private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;

    /**
     * Pause before the first retry. Doubles with every further retry.
     */
    private Duration initialBackoff = RetryPolicy.DEFAULT_INITIAL_BACKOFF;

    /**
     * Upper bound for a single pause between two attempts.
     */
    private Duration maxBackoff = RetryPolicy.DEFAULT_MAX_BACKOFF;

    /**
     * Connect and read timeout of every outbound HTTP call.
     */
    private Duration timeout = Duration.ofSeconds(10);

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff);
    }
}
