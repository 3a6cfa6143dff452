package ch.so.arp.workbench.cache;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the in-memory response caches.
 */
@ConfigurationProperties(prefix = "rag.cache")
public class CacheProperties {

    /**
     * Global switch. When false neither cache stores nor serves entries.
     */
    private boolean enabled = true;

    /**
     * Time-to-live of a cache entry, counted from insertion.
     */
    private Duration ttl = Duration.ofSeconds(60);

    private int searchCapacity = 1024;

    private int chatCapacity = 512;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public int getSearchCapacity() {
        return searchCapacity;
    }

    public void setSearchCapacity(int searchCapacity) {
        this.searchCapacity = searchCapacity;
    }

    public int getChatCapacity() {
        return chatCapacity;
    }

    public void setChatCapacity(int chatCapacity) {
        this.chatCapacity = chatCapacity;
    }
}
