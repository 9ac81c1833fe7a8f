package io.mnemo.core.embedding;

import java.io.IOException;

public class EmbeddingException extends IOException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
