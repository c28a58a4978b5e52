package im.arun.docoutline.ranking;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.docoutline.config.OutlineConfig;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Unit tests for {@link OpenAIEmbeddingClient}. */
class OpenAIEmbeddingClientTest {

    private MockWebServer server;
    private OutlineConfig.Ranking config;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        config = new OutlineConfig.Ranking();
        config.setEmbeddingUrl(server.url("/v1/embeddings").toString());
        config.setEmbeddingModel("test-embedding");
        config.setApiKey("sk-test");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Vectors come back in input order whatever the response order")
    void shouldOrderVectorsByIndex() throws Exception {
        server.enqueue(json("{\"data\":["
            + "{\"index\":1,\"embedding\":[0.0,1.0]},"
            + "{\"index\":0,\"embedding\":[1.0,0.0]}]}"));
        OpenAIEmbeddingClient client = new OpenAIEmbeddingClient(config, 1);

        List<double[]> vectors = client.embed(List.of("query", "heading"));

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(0)).containsExactly(1.0, 0.0);
        assertThat(vectors.get(1)).containsExactly(0.0, 1.0);
    }

    @Test
    @DisplayName("One batched request carries the model, inputs and bearer token")
    void shouldSendBatchedRequest() throws Exception {
        server.enqueue(json("{\"data\":[{\"index\":0,\"embedding\":[1.0]},{\"index\":1,\"embedding\":[2.0]}]}"));
        OpenAIEmbeddingClient client = new OpenAIEmbeddingClient(config, 1);

        client.embed(List.of("first", "second"));

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/v1/embeddings");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("test-embedding");
        assertThat(body.path("input")).hasSize(2);
        assertThat(body.path("input").get(1).asText()).isEqualTo("second");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Server errors are retried")
    void shouldRetryAfterServerError() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("overloaded"));
        server.enqueue(json("{\"data\":[{\"index\":0,\"embedding\":[0.5]}]}"));
        OpenAIEmbeddingClient client = new OpenAIEmbeddingClient(config, 1);

        List<double[]> vectors = client.embed(List.of("query"));

        assertThat(vectors.get(0)).containsExactly(0.5);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Three failures in a row give up with an embedding error")
    void shouldFailAfterMaxRetries() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(503));
        }
        OpenAIEmbeddingClient client = new OpenAIEmbeddingClient(config, 1);

        assertThatThrownBy(() -> client.embed(List.of("query")))
            .isInstanceOf(EmbeddingException.class)
            .hasMessageContaining("Max retries");
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("A response with the wrong number of vectors is rejected")
    void shouldRejectCountMismatch() {
        server.enqueue(json("{\"data\":[{\"index\":0,\"embedding\":[1.0]}]}"));
        OpenAIEmbeddingClient client = new OpenAIEmbeddingClient(config, 1);

        assertThatThrownBy(() -> client.embed(List.of("a", "b")))
            .isInstanceOf(EmbeddingException.class)
            .hasMessageContaining("Expected 2 embeddings");
    }

    @Test
    @DisplayName("No request is made for no texts")
    void shouldSkipRequest_forEmptyInput() throws Exception {
        OpenAIEmbeddingClient client = new OpenAIEmbeddingClient(config, 1);

        assertThat(client.embed(List.of())).isEmpty();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    @DisplayName("A missing endpoint is a configuration error")
    void shouldRejectBlankEndpoint() {
        config.setEmbeddingUrl("");

        assertThatThrownBy(() -> new OpenAIEmbeddingClient(config))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
