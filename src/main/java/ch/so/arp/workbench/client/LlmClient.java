package ch.so.arp.workbench.client;

import java.util.List;

/**
 * Abstraction over the language model integration. Implementations can either
 * call an OpenAI compatible chat completion API or return predictable answers
 * for tests and local development.
 */
public interface LlmClient {

    /**
     * Generate an answer for the given conversation.
     *
     * @param messages system prompt, prior turns and the grounded user prompt,
     *                 in order
     * @return the generated answer text
     */
    String generate(List<ChatMessage> messages);
}
