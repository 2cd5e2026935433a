package org.courtside.rotation.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes session state to WebSocket subscribers of {@code /topic/sessions/{id}}.
 */
@Component
public class SessionUpdatePublisher {

    private static final Logger logger = LoggerFactory.getLogger(SessionUpdatePublisher.class);

    private final SimpMessagingTemplate messagingTemplate;

    public SessionUpdatePublisher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    public static String topic(String sessionId) {
        return "/topic/sessions/" + sessionId;
    }

    /**
     * Broadcasts the session. Failures are logged and never propagate to the caller.
     */
    public void publish(Session session) {
        try {
            messagingTemplate.convertAndSend(topic(session.id()), session);
        } catch (RuntimeException e) {
            logger.warn("Failed to send WebSocket update for session {}", session.id(), e);
        }
    }
}
