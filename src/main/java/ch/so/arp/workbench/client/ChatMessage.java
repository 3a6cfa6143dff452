package ch.so.arp.workbench.client;

/**
 * One turn of a conversation, also used as the message format handed to the
 * language model.
 */
public record ChatMessage(MessageRole role, String content) {

    public static ChatMessage system(String content) {
        return new ChatMessage(MessageRole.SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(MessageRole.USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(MessageRole.ASSISTANT, content);
    }
}
