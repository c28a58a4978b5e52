package im.arun.docoutline.ranking;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.docoutline.config.OutlineConfig;
import okhttp3.ConnectionPool;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Client for OpenAI-compatible {@code /v1/embeddings} endpoints with retry and exponential backoff.
 * All texts are sent in one batched request.
 */
public class OpenAIEmbeddingClient implements EmbeddingClient {
    private static final Logger logger = LoggerFactory.getLogger(OpenAIEmbeddingClient.class);
    private static final int MAX_RETRIES = 3;
    private static final long BASE_BACKOFF_MS = 1000;
    private static final long MAX_BACKOFF_MS = 30000;
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TokenCounter tokenCounter;
    private final String url;
    private final String model;
    private final String apiKey;
    private final int maxInputTokens;
    private final long baseBackoffMs;

    public OpenAIEmbeddingClient(OutlineConfig.Ranking config) {
        this(config, BASE_BACKOFF_MS);
    }

    OpenAIEmbeddingClient(OutlineConfig.Ranking config, long baseBackoffMs) {
        if (config.getEmbeddingUrl() == null || config.getEmbeddingUrl().isBlank()) {
            throw new IllegalArgumentException("Embedding endpoint URL must be configured");
        }
        this.url = config.getEmbeddingUrl();
        this.model = config.getEmbeddingModel();
        this.apiKey = config.getApiKey() != null ? config.getApiKey() : System.getenv("OPENAI_API_KEY");
        this.maxInputTokens = config.getMaxInputTokens();
        this.baseBackoffMs = baseBackoffMs;

        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(120, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .connectionPool(new ConnectionPool(8, 5, TimeUnit.MINUTES))
                .build();
        this.objectMapper = new ObjectMapper();
        this.tokenCounter = new TokenCounter();
    }

    @Override
    public List<double[]> embed(List<String> texts) throws EmbeddingException {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<String> inputs = new ArrayList<>(texts.size());
        for (String text : texts) {
            inputs.add(tokenCounter.truncate(text, maxInputTokens));
        }

        for (int attempt = 0; attempt < MAX_RETRIES; attempt++) {
            try {
                return parse(executeRequest(inputs), texts.size());
            } catch (IOException e) {
                logger.warn("Embedding call failed (attempt {}/{}): {}", attempt + 1, MAX_RETRIES, e.getMessage());
                if (attempt == MAX_RETRIES - 1) {
                    throw new EmbeddingException("Max retries reached for embedding call", e);
                }
                try {
                    long backoff = Math.min(baseBackoffMs * (1L << attempt), MAX_BACKOFF_MS);
                    logger.debug("Retrying in {}ms", backoff);
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new EmbeddingException("Interrupted during retry wait", ie);
                }
            }
        }
        throw new EmbeddingException("Unexpected: exceeded max retries without a result");
    }

    private String executeRequest(List<String> inputs) throws IOException {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("input", inputs);

        Request.Builder request = new Request.Builder()
                .url(url)
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(objectMapper.writeValueAsString(requestBody), JSON));
        if (apiKey != null && !apiKey.isEmpty()) {
            request.addHeader("Authorization", "Bearer " + apiKey);
        }

        try (Response response = httpClient.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                String errorBody = response.body() != null ? response.body().string() : "No error body";
                throw new IOException("Embedding API error (HTTP " + response.code() + "): " + errorBody);
            }
            return response.body().string();
        }
    }

    private List<double[]> parse(String body, int expected) throws EmbeddingException, IOException {
        JsonNode data = objectMapper.readTree(body).path("data");
        if (!data.isArray() || data.size() != expected) {
            throw new EmbeddingException("Expected " + expected + " embeddings, got " + data.size());
        }
        double[][] vectors = new double[expected][];
        for (int i = 0; i < data.size(); i++) {
            JsonNode item = data.get(i);
            int index = item.path("index").asInt(i);
            if (index < 0 || index >= expected) {
                throw new EmbeddingException("Embedding index out of range: " + index);
            }
            JsonNode embedding = item.path("embedding");
            double[] vector = new double[embedding.size()];
            for (int j = 0; j < vector.length; j++) {
                vector[j] = embedding.get(j).asDouble();
            }
            vectors[index] = vector;
        }
        List<double[]> result = new ArrayList<>(expected);
        for (double[] vector : vectors) {
            if (vector == null) {
                throw new EmbeddingException("Embedding response is missing an index");
            }
            result.add(vector);
        }
        return result;
    }
}
