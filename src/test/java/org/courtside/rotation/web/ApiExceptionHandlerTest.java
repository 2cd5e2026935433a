package org.courtside.rotation.web;

import org.courtside.rotation.ledger.PlayerNotFoundException;
import org.courtside.rotation.session.SessionNotFoundException;
import org.courtside.rotation.session.SessionStateException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    void sessionNotFound_maps404() {
        ResponseEntity<ApiErrorResponse> response =
            handler.handleSessionNotFound(new SessionNotFoundException("Session not found: x"));

        assertEquals(404, response.getStatusCode().value());
        assertEquals("SESSION_NOT_FOUND", response.getBody().code());
        assertEquals("Session not found: x", response.getBody().message());
    }

    @Test
    void playerNotFound_maps404() {
        ResponseEntity<ApiErrorResponse> response = handler.handlePlayerNotFound(new PlayerNotFoundException("z"));

        assertEquals(404, response.getStatusCode().value());
        assertEquals("PLAYER_NOT_FOUND", response.getBody().code());
    }

    @Test
    void stateConflict_maps409() {
        ResponseEntity<ApiErrorResponse> response =
            handler.handleState(new SessionStateException("Session s1 is COMPLETED"));

        assertEquals(409, response.getStatusCode().value());
        assertEquals("SESSION_STATE_CONFLICT", response.getBody().code());
    }

    @Test
    void illegalArgument_maps400() {
        ResponseEntity<ApiErrorResponse> response =
            handler.handleInvalidArgument(new IllegalArgumentException("Duplicate participant id: a"));

        assertEquals(400, response.getStatusCode().value());
        assertEquals("BAD_REQUEST", response.getBody().code());
    }

    @Test
    void unexpectedError_maps500() {
        ResponseEntity<ApiErrorResponse> response = handler.handleRuntime(new IllegalStateException("boom"));

        assertEquals(500, response.getStatusCode().value());
        assertEquals("INTERNAL_ERROR", response.getBody().code());
    }
}
