package ch.so.arp.workbench.metrics;

/**
 * The four durations measured for every chat pipeline run.
 */
public enum TimingField {

    RETRIEVE("retrieve_ms"),
    WEB("web_ms"),
    GENERATE("generate_ms"),
    TOTAL("total_ms");

    private final String key;

    TimingField(String key) {
        this.key = key;
    }

    /**
     * @return the name used in snapshots, for example {@code retrieve_ms}
     */
    public String key() {
        return key;
    }

    /**
     * @return the stage tag used for exported timers
     */
    String stage() {
        return name().toLowerCase();
    }
}
