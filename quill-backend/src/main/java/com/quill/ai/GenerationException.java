package com.quill.ai;

/**
 * The text-generation or embedding gateway is disabled, unreachable or returned an unusable
 * response. Not retried by the self-correcting executor.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
