package com.cragmate.x.exceptions;

/**
 * Thrown when a matching request carries invalid input.
 * <p>
 * The engine raises it for a non-positive result limit; values above the maximum are
 * clamped instead of rejected.
 * </p>
 */
public class BadRequestException extends RuntimeException {

    /**
     * Constructs a new BadRequestException with the specified detail message.
     *
     * @param message the detail message which explains what was wrong with the request.
     */
    public BadRequestException(String message) {
        super(message);
    }
}
