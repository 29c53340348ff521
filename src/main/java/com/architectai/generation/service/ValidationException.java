package com.architectai.generation.service;

/**
 * A request was malformed or unsupported. Raised synchronously; no job is created.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) { super(message); }
}
