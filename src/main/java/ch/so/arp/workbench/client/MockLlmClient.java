package ch.so.arp.workbench.client;

import java.util.List;
import java.util.StringJoiner;

/**
 * Deterministic {@link LlmClient} used in tests and local development where no
 * chat completion API should be contacted.
 */
class MockLlmClient implements LlmClient {

    private static final String DEFAULT_ANSWER = "This is a mocked response. "
            + "Provide an API key to reach the real chat completion service.";

    @Override
    public String generate(List<ChatMessage> messages) {
        StringJoiner joiner = new StringJoiner("\n");
        joiner.add("[mocked answer]");
        joiner.add(DEFAULT_ANSWER);
        if (!messages.isEmpty()) {
            ChatMessage prompt = messages.get(messages.size() - 1);
            joiner.add("Prompt length: " + prompt.content().length());
        }
        joiner.add("Total messages: " + messages.size());
        return joiner.toString();
    }
}
