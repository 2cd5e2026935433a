package org.courtside.rotation.session;

public enum SessionStatus {
    IN_PROGRESS,
    COMPLETED
}
