package ch.so.arp.workbench.resilience;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

/**
 * Single entry point for every external capability invocation. Applies a
 * bounded exponential retry to failures the {@link FailureClassifier} deems
 * transient and converts whatever escapes into an
 * {@link UpstreamServiceException} naming the capability.
 */
public class ResilientCaller {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResilientCaller.class);

    private static final double BACKOFF_MULTIPLIER = 2.0d;

    private final FailureClassifier classifier;
    private final RetryPolicy defaultPolicy;

    public ResilientCaller(FailureClassifier classifier, RetryPolicy defaultPolicy) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy");
    }

    public <T> T call(String service, Supplier<T> invocation) {
        return call(service, invocation, defaultPolicy);
    }

    public <T> T call(String service, Supplier<T> invocation, RetryPolicy policy) {
        Objects.requireNonNull(invocation, "invocation");
        Retry retry = Retry.of(service, toConfig(policy));
        retry.getEventPublisher().onRetry(event -> LOGGER.warn(
                "Call to {} failed (attempt {}/{}), retrying in {} ms: {}", service,
                event.getNumberOfRetryAttempts(), policy.maxAttempts(), event.getWaitInterval().toMillis(),
                describe(event.getLastThrowable())));

        AtomicInteger attempts = new AtomicInteger();
        try {
            return retry.executeSupplier(() -> {
                attempts.incrementAndGet();
                return invocation.get();
            });
        } catch (UpstreamServiceException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            boolean retryable = classifier.isRetryable(ex);
            LOGGER.error("Call to {} failed after {} attempt(s) ({}): {}", service, attempts.get(),
                    retryable ? "retries exhausted" : "permanent failure", describe(ex));
            throw new UpstreamServiceException(service,
                    "Upstream " + service + " call failed. Please try again later.", attempts.get(), ex);
        }
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    private RetryConfig toConfig(RetryPolicy policy) {
        return RetryConfig.custom()
                .maxAttempts(policy.maxAttempts())
                .intervalFunction(backoff(policy))
                .retryOnException(classifier::isRetryable)
                .build();
    }

    /**
     * Pause in milliseconds before retry {@code n}, starting at 1.
     */
    static IntervalFunction backoff(RetryPolicy policy) {
        return IntervalFunction.ofExponentialBackoff(policy.initialBackoff().toMillis(), BACKOFF_MULTIPLIER,
                policy.maxBackoff().toMillis());
    }

    private static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown";
        }
        return throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }
}
