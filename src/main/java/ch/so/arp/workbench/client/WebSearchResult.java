package ch.so.arp.workbench.client;

public record WebSearchResult(String title, String url, String content) {
}
