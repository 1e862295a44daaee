package fr.lapetina.aitranslation.domain.exception;

/**
 * An embedding provider could not produce vectors.
 */
public final class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
