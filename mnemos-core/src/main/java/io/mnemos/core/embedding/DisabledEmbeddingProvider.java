package io.mnemos.core.embedding;

import java.util.List;
import java.util.Objects;

public final class DisabledEmbeddingProvider implements EmbeddingProvider {
    private final String name;
    private final String reason;

    public DisabledEmbeddingProvider(String name, String reason) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.reason = reason == null || reason.isBlank() ? "embedding provider is disabled" : reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String modelName() {
        return "";
    }

    @Override
    public int dimensions() {
        return 0;
    }

    @Override
    public double[] embed(String text) throws EmbeddingException {
        throw new EmbeddingException(reason);
    }

    @Override
    public List<double[]> embedBatch(List<String> texts) throws EmbeddingException {
        throw new EmbeddingException(reason);
    }

    public String reason() {
        return reason;
    }
}
