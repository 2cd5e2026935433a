package org.courtside.rotation.session;

/**
 * Thrown when a requested session or one of its games does not exist.
 */
public class SessionNotFoundException extends RuntimeException {
    public SessionNotFoundException(String message) {
        super(message);
    }
}
