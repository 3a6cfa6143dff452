package ch.so.arp.workbench.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

import ch.so.arp.workbench.client.ChatMessage;
import ch.so.arp.workbench.client.MessageRole;

/**
 * Builds the grounded message list for the language model: a fixed system
 * prompt, the prior conversation and one user prompt embedding all sources as
 * numbered snippets that the answer can cite as [1], [2], ...
 */
public class PromptBuilder {

    static final String SYSTEM_PROMPT = """
            You are a focused research assistant for a retrieval-augmented generation (RAG) system.

            You MUST:
            - Answer the user's question using ONLY the provided context snippets.
            - Treat each context snippet as a citation, referenced inline as [1], [2], etc.
            - Prefer concise, clear explanations over long essays.
            - Never fabricate facts that are not supported by the context.

            If the context is insufficient to answer the question:
            - Say that you do not know based on the current context.
            - Suggest that the caller enable or use web search fallback for a more complete answer.
            """;

    private static final String USER_PROMPT_TEMPLATE = """
            You are given context snippets retrieved from a vector store and optionally from web search.

            Each snippet is numbered like [1], [2], etc. Use these numbers to cite sources inline in your answer.

            Context:
            %s

            User question:
            %s

            Instructions:
            - Use the context to answer the question.
            - Use inline citations like [1], [2] whenever you rely on a snippet.
            - If you cannot answer from the context, say so explicitly and recommend using web search fallback.
            """;

    public List<ChatMessage> buildMessages(List<ChatMessage> history, String question, List<SourceSnippet> sources) {
        List<ChatMessage> messages = new ArrayList<>(history.size() + 2);
        messages.add(ChatMessage.system(SYSTEM_PROMPT));
        for (ChatMessage message : history) {
            if (message.content() == null || message.content().isEmpty()) {
                continue;
            }
            messages.add(message.role() == MessageRole.ASSISTANT ? ChatMessage.assistant(message.content())
                    : ChatMessage.user(message.content()));
        }
        messages.add(ChatMessage.user(USER_PROMPT_TEMPLATE.formatted(formatContext(sources), question)));
        return messages;
    }

    /**
     * Formats the sources as numbered blocks, each headed by its index, origin
     * and title, followed by the URL and text when present.
     */
    String formatContext(List<SourceSnippet> sources) {
        StringJoiner blocks = new StringJoiner("\n\n");
        int index = 1;
        for (SourceSnippet source : sources) {
            String origin = isEmpty(source.origin()) ? "unknown" : source.origin();
            String header = "[" + index++ + "] (" + origin + ")";
            if (!isEmpty(source.title())) {
                header += " " + source.title();
            }
            blocks.add(header);
            if (!isEmpty(source.url())) {
                blocks.add(source.url());
            }
            if (!isEmpty(source.text())) {
                blocks.add(source.text());
            }
        }
        return blocks.toString();
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
