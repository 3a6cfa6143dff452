package ch.so.arp.workbench.resilience;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Default classification for HTTP based capabilities. Connection problems,
 * timeouts, rate limiting (429) and server errors (5xx) are transient; every
 * other failure, including other 4xx responses and unreadable bodies, is
 * permanent.
 */
public class HttpFailureClassifier implements FailureClassifier {

    private static final int TOO_MANY_REQUESTS = 429;

    @Override
    public boolean isRetryable(Throwable failure) {
        if (failure instanceof ResourceAccessException || failure instanceof IOException
                || failure instanceof TimeoutException) {
            return true;
        }
        if (failure instanceof RestClientResponseException responseException) {
            return isRetryableStatus(responseException.getStatusCode());
        }
        return false;
    }

    static boolean isRetryableStatus(HttpStatusCode status) {
        return status.value() == TOO_MANY_REQUESTS || status.is5xxServerError();
    }
}
