package ch.so.arp.workbench.pipeline;

/**
 * Thrown when a request value is out of range after defaults were applied.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
