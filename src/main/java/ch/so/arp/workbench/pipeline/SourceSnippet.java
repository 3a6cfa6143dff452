package ch.so.arp.workbench.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A piece of retrieved or web sourced text together with its provenance.
 *
 * @param origin label of the collection the snippet came from, {@code web}
 *               for web search results
 * @param score  relevance score from the vector index, always 0 for web
 *               results
 */
public record SourceSnippet(
        @JsonProperty("source") String origin,
        String title,
        String url,
        double score,
        @JsonProperty("chunk_text") String text) {

    public static final String WEB_ORIGIN = "web";

    public static SourceSnippet web(String title, String url, String text) {
        return new SourceSnippet(WEB_ORIGIN, title, url, 0.0d, text);
    }
}
