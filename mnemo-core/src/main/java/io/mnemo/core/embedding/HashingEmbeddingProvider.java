package io.mnemo.core.embedding;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public final class HashingEmbeddingProvider implements EmbeddingProvider {
    public static final int DEFAULT_DIMENSIONS = 384;

    private final int dimensions;

    public HashingEmbeddingProvider() {
        this(DEFAULT_DIMENSIONS);
    }

    public HashingEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive: " + dimensions);
        }
        this.dimensions = dimensions;
    }

    @Override
    public float[] embedDense(String text) {
        double[] vector = new double[dimensions];
        for (String token : TextTokenizer.tokenize(text)) {
            vector[Math.floorMod(token.hashCode(), dimensions)] += 1.0;
        }

        double norm = 0.0;
        for (double value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);

        float[] embedding = new float[dimensions];
        if (norm == 0.0) {
            return embedding;
        }
        for (int i = 0; i < dimensions; i++) {
            embedding[i] = (float) (vector[i] / norm);
        }
        return embedding;
    }

    @Override
    public SparseVector embedSparse(String text) {
        return sparse(text);
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String modelId() {
        return "hashing/" + dimensions;
    }

    static SparseVector sparse(String text) {
        List<String> tokens = TextTokenizer.tokenize(text);
        if (tokens.isEmpty()) {
            return SparseVector.empty();
        }

        Map<Integer, Integer> counts = new TreeMap<>();
        for (String token : tokens) {
            counts.merge(token.hashCode() & Integer.MAX_VALUE, 1, Integer::sum);
        }

        int[] indices = new int[counts.size()];
        float[] values = new float[counts.size()];
        int i = 0;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            indices[i] = entry.getKey();
            values[i] = (float) (1.0 + Math.log(entry.getValue()));
            i++;
        }
        return new SparseVector(indices, values);
    }
}
