package com.architectai.generation.service;

/**
 * The content generator failed or produced nothing usable.
 */
public class GenerationException extends RuntimeException {
    public GenerationException(String message) { super(message); }
    public GenerationException(String message, Throwable cause) { super(message, cause); }
}
