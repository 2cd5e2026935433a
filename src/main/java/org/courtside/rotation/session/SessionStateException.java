package org.courtside.rotation.session;

/**
 * Thrown when an operation is not allowed in the session's current state,
 * such as completing a game that was never started.
 */
public class SessionStateException extends RuntimeException {
    public SessionStateException(String message) {
        super(message);
    }
}
