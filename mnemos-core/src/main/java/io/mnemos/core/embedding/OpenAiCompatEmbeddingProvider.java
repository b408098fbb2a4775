package io.mnemos.core.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for any endpoint that speaks the OpenAI {@code POST /embeddings} shape (OpenAI, OpenRouter,
 * self-hosted gateways).
 */
public final class OpenAiCompatEmbeddingProvider implements EmbeddingProvider {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatEmbeddingProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final String model;
    private final Map<String, String> extraHeaders;
    private final int maxAttempts;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private volatile int dimensions;

    public OpenAiCompatEmbeddingProvider(
        String name,
        String apiKey,
        String apiBase,
        String model,
        int dimensions,
        Map<String, String> extraHeaders,
        Duration timeout
    ) {
        this(name, apiKey, apiBase, model, dimensions, extraHeaders, timeout, 3);
    }

    public OpenAiCompatEmbeddingProvider(
        String name,
        String apiKey,
        String apiBase,
        String model,
        int dimensions,
        Map<String, String> extraHeaders,
        Duration timeout,
        int maxAttempts
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.dimensions = Math.max(0, dimensions);
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.maxAttempts = Math.max(1, maxAttempts);
        Duration callTimeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(callTimeout)
            .writeTimeout(callTimeout)
            .callTimeout(callTimeout)
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String modelName() {
        return model;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public double[] embed(String text) throws EmbeddingException {
        List<double[]> vectors = embedBatch(List.of(text == null ? "" : text));
        return vectors.get(0);
    }

    @Override
    public List<double[]> embedBatch(List<String> texts) throws EmbeddingException {
        if (texts.isEmpty()) {
            return List.of();
        }
        if (apiKey.isBlank()) {
            throw new EmbeddingException("missing API key for embedding provider " + name);
        }

        long delayMs = 250;
        IOException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = client.newCall(buildRequest(texts)).execute()) {
                ResponseBody body = response.body();
                String payload = body == null ? "" : body.string();
                if (!response.isSuccessful()) {
                    boolean retryable = response.code() == 429 || response.code() >= 500;
                    if (retryable && attempt < maxAttempts) {
                        LOG.debug("Embedding call to {} returned HTTP {}, retrying", name, response.code());
                        sleep(delayMs);
                        delayMs = Math.min(delayMs * 2, 2000);
                        continue;
                    }
                    throw new EmbeddingException(name + " embedding failed: HTTP " + response.code() + " " + payload);
                }
                return parse(payload, texts.size());
            } catch (EmbeddingException e) {
                throw e;
            } catch (IOException e) {
                lastFailure = e;
                if (attempt < maxAttempts) {
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                }
            }
        }
        throw new EmbeddingException(
            name + " embedding failed: " + (lastFailure == null ? "exhausted retries" : lastFailure.getMessage()),
            lastFailure
        );
    }

    private Request buildRequest(List<String> texts) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("input", texts);

        Request.Builder builder = new Request.Builder()
            .url(apiBase.newBuilder().addPathSegment("embeddings").build())
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json");
        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private List<double[]> parse(String payload, int expected) throws EmbeddingException {
        JsonNode data;
        try {
            data = mapper.readTree(payload).path("data");
        } catch (IOException e) {
            throw new EmbeddingException(name + " returned malformed JSON", e);
        }
        if (!data.isArray() || data.size() != expected) {
            throw new EmbeddingException(
                name + " returned " + (data.isArray() ? data.size() : 0) + " embeddings for " + expected + " inputs"
            );
        }

        double[][] ordered = new double[expected][];
        for (int i = 0; i < data.size(); i++) {
            JsonNode item = data.get(i);
            int index = item.path("index").asInt(i);
            if (index < 0 || index >= expected) {
                throw new EmbeddingException(name + " returned out-of-range embedding index " + index);
            }
            JsonNode values = item.path("embedding");
            double[] vector = new double[values.size()];
            for (int j = 0; j < vector.length; j++) {
                vector[j] = values.get(j).asDouble();
            }
            if (vector.length == 0) {
                throw new EmbeddingException(name + " returned an empty embedding");
            }
            ordered[index] = vector;
        }

        List<double[]> vectors = new ArrayList<>(expected);
        for (double[] vector : ordered) {
            if (vector == null) {
                throw new EmbeddingException(name + " response is missing an embedding");
            }
            vectors.add(vector);
        }
        int reported = vectors.get(0).length;
        if (reported != dimensions) {
            LOG.debug("Embedding provider {} reports {} dimensions", name, reported);
            dimensions = reported;
        }
        return vectors;
    }

    private void sleep(long delayMs) throws EmbeddingException {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException(name + " embedding interrupted while waiting to retry", ie);
        }
    }
}
