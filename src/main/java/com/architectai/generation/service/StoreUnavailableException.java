package com.architectai.generation.service;

/**
 * The durable version storage could not be read or written.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) { super(message, cause); }
}
