package org.courtside.rotation.web;

import org.courtside.rotation.session.Session;
import org.courtside.rotation.session.SessionNotFoundException;
import org.courtside.rotation.session.SessionService;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.SendTo;
import org.springframework.stereotype.Controller;

/**
 * WebSocket controller for session updates.
 * Clients can subscribe to /topic/sessions/{sessionId} to receive the queue as it changes.
 */
@Controller
public class SessionProgressController {

    private final SessionService sessionService;

    public SessionProgressController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    /**
     * Returns the current session state to a new subscriber.
     * Further updates are pushed by the session service on every change.
     *
     * @param sessionId the session to subscribe to
     * @return the current session, or null if it does not exist
     */
    @MessageMapping("/sessions/{sessionId}/subscribe")
    @SendTo("/topic/sessions/{sessionId}")
    public Session subscribeSession(@DestinationVariable String sessionId) {
        try {
            return sessionService.getSession(sessionId);
        } catch (SessionNotFoundException e) {
            return null;
        }
    }
}
