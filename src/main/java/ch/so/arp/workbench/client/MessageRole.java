package ch.so.arp.workbench.client;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Author of a chat message.
 */
public enum MessageRole {

    SYSTEM,
    USER,
    ASSISTANT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageRole fromValue(String value) {
        if (value == null) {
            return USER;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "system" -> SYSTEM;
            case "assistant" -> ASSISTANT;
            default -> USER;
        };
    }
}
