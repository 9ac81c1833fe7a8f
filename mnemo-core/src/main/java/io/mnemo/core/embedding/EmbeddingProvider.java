package io.mnemo.core.embedding;

import java.io.IOException;

/**
 * Turns text into a dense vector of fixed length and a sparse term-weight vector.
 *
 * <p>Blank text yields a zero dense vector and an empty sparse vector. Provider failures are
 * reported as {@link EmbeddingException}, never as a zero vector.
 */
public interface EmbeddingProvider {

    float[] embedDense(String text) throws IOException;

    SparseVector embedSparse(String text) throws IOException;

    int dimensions();

    String modelId();
}
