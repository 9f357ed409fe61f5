package com.browserswarm.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open observer connections. A failed send marks the session for removal at the end of
 * the broadcast pass.
 */
@Component
public class StatusHub {
    private static final Logger log = LoggerFactory.getLogger(StatusHub.class);

    private final ObjectMapper objectMapper;
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public StatusHub(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void register(WebSocketSession session) {
        sessions.put(session.getId(), session);
        log.info("Observer {} connected ({} open).", session.getId(), sessions.size());
    }

    public void remove(WebSocketSession session) {
        if (sessions.remove(session.getId()) != null) {
            log.info("Observer {} disconnected ({} open).", session.getId(), sessions.size());
        }
    }

    public void broadcast(StatusEvent event) {
        String payload = serialize(event);
        if (payload == null) {
            return;
        }
        List<WebSocketSession> stale = new ArrayList<>();
        for (WebSocketSession session : sessions.values()) {
            if (!send(session, payload)) {
                stale.add(session);
            }
        }
        for (WebSocketSession session : stale) {
            sessions.remove(session.getId());
            log.warn("Removed stale observer {}.", session.getId());
        }
    }

    /**
     * Sends one event to a single observer, for snapshots and replies.
     */
    public boolean sendTo(WebSocketSession session, StatusEvent event) {
        String payload = serialize(event);
        return payload != null && send(session, payload);
    }

    public int sessionCount() {
        return sessions.size();
    }

    private boolean send(WebSocketSession session, String payload) {
        if (!session.isOpen()) {
            return false;
        }
        try {
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
            return true;
        } catch (IOException | IllegalStateException ex) {
            log.debug("Failed to send status event to {}: {}", session.getId(), ex.getMessage());
            return false;
        }
    }

    private String serialize(StatusEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            log.error("Failed to serialize {} event: {}", event.type(), ex.getOriginalMessage());
            return null;
        }
    }
}
