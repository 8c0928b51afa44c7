package com.subtrack.backend.exceptions;

/**
 * Thrown when the caller's identity is missing or does not match the resource it asks for.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
