package ch.so.arp.workbench.resilience;

/**
 * Signals a missing or invalid setup, for example absent credentials for a
 * real capability adapter. Raised while the application context starts so the
 * service refuses to run in a degraded state.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
