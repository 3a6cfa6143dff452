package ch.so.arp.workbench.chat;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import ch.so.arp.workbench.client.VectorHit;

public record SearchResponse(String namespace, String query, @JsonProperty("top_k") int topK, List<VectorHit> hits) {

    public SearchResponse {
        hits = List.copyOf(hits);
    }
}
