package de.upb.sse.reorg.exceptions;

public class ReorganizationException extends RuntimeException {
    public ReorganizationException(String message) {
        super(message);
    }

    public ReorganizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
