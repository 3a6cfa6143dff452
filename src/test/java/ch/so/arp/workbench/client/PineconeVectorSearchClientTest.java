package ch.so.arp.workbench.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.List;
import java.util.Map;

import org.hamcrest.Matchers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

import ch.so.arp.workbench.resilience.ConfigurationException;

class PineconeVectorSearchClientTest {

    private PineconeProperties properties;
    private RestClient.Builder builder;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        properties = new PineconeProperties();
        properties.setApiKey("pc-key");
        properties.setHost("https://index.example.com");
        properties.setTextField("text");
        builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
    }

    @Test
    void searchesNamespaceAndMapsTextField() {
        server.expect(requestTo("https://index.example.com/records/namespaces/dev/search"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Api-Key", "pc-key"))
                .andExpect(header("X-Pinecone-API-Version", "2025-01"))
                .andExpect(jsonPath("$.query.inputs.text").value("zoning"))
                .andExpect(jsonPath("$.query.top_k").value(2))
                .andExpect(jsonPath("$.query.filter").doesNotExist())
                .andExpect(jsonPath("$.fields[0]").value("text"))
                .andRespond(withSuccess("""
                        {"result":{"hits":[
                          {"_id":"doc-1","_score":0.91,"fields":{"text":"Zoning text","title":"Plan","url":null}},
                          {"_id":"doc-2","_score":0.42,"fields":{"title":"No text"}}
                        ]},"usage":{"read_units":1}}
                        """, MediaType.APPLICATION_JSON));

        PineconeVectorSearchClient client = new PineconeVectorSearchClient(properties, builder);
        List<VectorHit> hits = client.search("dev", "zoning", 2, Map.of());

        server.verify();
        assertThat(hits).extracting(VectorHit::id).containsExactly("doc-1", "doc-2");
        assertThat(hits.get(0).score()).isEqualTo(0.91d);
        assertThat(hits.get(0).field(VectorHit.TEXT_FIELD, "")).isEqualTo("Zoning text");
        assertThat(hits.get(0).fields()).doesNotContainKey("text");
        assertThat(hits.get(0).field("url", "none")).isEqualTo("none");
        assertThat(hits.get(1).field(VectorHit.TEXT_FIELD, "fallback")).isEqualTo("fallback");
    }

    @Test
    void sendsFilterWhenGiven() {
        server.expect(requestTo("https://index.example.com/records/namespaces/prod/search"))
                .andExpect(jsonPath("$.query.filter.year", Matchers.is(2024)))
                .andRespond(withSuccess("{\"result\":{\"hits\":[]}}", MediaType.APPLICATION_JSON));

        List<VectorHit> hits = new PineconeVectorSearchClient(properties, builder)
                .search("prod", "zoning", 5, Map.of("year", 2024));

        server.verify();
        assertThat(hits).isEmpty();
    }

    @Test
    void propagatesServerErrors() {
        server.expect(requestTo("https://index.example.com/records/namespaces/dev/search"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andRespond(withServerError());

        PineconeVectorSearchClient client = new PineconeVectorSearchClient(properties, builder);

        assertThatThrownBy(() -> client.search("dev", "zoning", 5, null))
                .isInstanceOf(HttpServerErrorException.class);
    }

    @Test
    void requiresKeyAndHost() {
        properties.setHost("");

        assertThatThrownBy(() -> new PineconeVectorSearchClient(properties, builder))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("rag.pinecone.host");
    }
}
