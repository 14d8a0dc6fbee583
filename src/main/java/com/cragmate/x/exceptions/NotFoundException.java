package com.cragmate.x.exceptions;

/**
 * Thrown when the viewer, the trip or a requested match cannot be found.
 * <p>
 * A trip owned by another user is reported exactly like a trip that does not exist,
 * so the message never reveals whether someone else's trip is there.
 * </p>
 */
public class NotFoundException extends RuntimeException {

    /**
     * Constructs a new {@link NotFoundException} with the specified message.
     *
     * @param m the detail message.
     */
    public NotFoundException(String m) {
        super(m);
    }
}
