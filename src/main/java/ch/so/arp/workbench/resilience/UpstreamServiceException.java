package ch.so.arp.workbench.resilience;

/**
 * Raised when an external capability (vector search, web search, language
 * model) failed permanently or kept failing after all retry attempts.
 */
public class UpstreamServiceException extends RuntimeException {

    private final String service;
    private final int attempts;

    public UpstreamServiceException(String service, String message, int attempts, Throwable cause) {
        super(message, cause);
        this.service = service;
        this.attempts = attempts;
    }

    public UpstreamServiceException(String service, String message) {
        this(service, message, 0, null);
    }

    public String getService() {
        return service;
    }

    /**
     * @return the number of invocations made before giving up, 0 when unknown
     */
    public int getAttempts() {
        return attempts;
    }
}
