package ch.so.arp.workbench.resilience;

/**
 * Decides whether a failed capability call may succeed when repeated.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * @param failure the exception thrown by the capability call
     * @return {@code true} for transient failures that should be retried,
     *         {@code false} for permanent ones
     */
    boolean isRetryable(Throwable failure);
}
