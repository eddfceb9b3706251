package dev.resumetailor.ai;

/**
 * Raised when an embedding or relevance backend cannot serve a request.
 * Never retried internally; the whole recommendation call fails.
 */
public class ModelInvocationException extends RuntimeException {

    public ModelInvocationException(String message) {
        super(message);
    }

    public ModelInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
