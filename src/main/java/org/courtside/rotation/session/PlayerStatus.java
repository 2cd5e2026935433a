package org.courtside.rotation.session;

/**
 * Whether a session player is currently available for the queue.
 */
public enum PlayerStatus {
    ACTIVE,
    LEFT;

    public PlayerStatus toggled() {
        return this == ACTIVE ? LEFT : ACTIVE;
    }
}
