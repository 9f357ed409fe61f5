package com.browserswarm.stream;

import static com.browserswarm.orchestration.SwarmConstants.*;

import com.browserswarm.orchestration.service.SwarmRunService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;

/**
 * Observer channel. Sends a full snapshot on connect and accepts {@code execute} and
 * {@code status} requests.
 */
@Component
@ConditionalOnProperty(name = "swarm.worker.enabled", havingValue = "false", matchIfMissing = true)
public class StatusWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(StatusWebSocketHandler.class);

    private final StatusHub hub;
    private final StatusPublisher publisher;
    private final SwarmRunService runService;
    private final ObjectMapper objectMapper;

    public StatusWebSocketHandler(StatusHub hub,
                                  StatusPublisher publisher,
                                  SwarmRunService runService,
                                  ObjectMapper objectMapper) {
        this.hub = hub;
        this.publisher = publisher;
        this.runService = runService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        hub.register(session);
        sendSnapshot(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        JsonNode request;
        try {
            request = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException ex) {
            reply(session, EVENT_ERROR, Map.of("message", "Invalid JSON"));
            return;
        }
        if (request == null || !request.isObject()) {
            reply(session, EVENT_ERROR, Map.of("message", "Invalid JSON"));
            return;
        }
        String type = request.path("type").asText("");
        switch (type) {
            case "execute" -> execute(session, request);
            case "status" -> sendSnapshot(session);
            default -> reply(session, EVENT_ERROR, Map.of("message", "Unknown message type: " + type));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        hub.remove(session);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Observer {} transport error: {}", session.getId(), exception.getMessage());
        hub.remove(session);
    }

    private void execute(WebSocketSession session, JsonNode request) {
        String prompt = request.hasNonNull("prompt")
                ? request.get("prompt").asText()
                : request.path("instruction").asText("");
        if (!StringUtils.hasText(prompt)) {
            reply(session, EVENT_ERROR, Map.of("message", "Missing prompt"));
            return;
        }
        String runId = runService.submit(prompt);
        reply(session, EVENT_STATUS, Map.of("runId", runId, "message", "Accepted"));
    }

    private void sendSnapshot(WebSocketSession session) {
        reply(session, EVENT_SNAPSHOT, runService.snapshot());
    }

    private void reply(WebSocketSession session, String type, Object payload) {
        hub.sendTo(session, publisher.newEvent(type, payload));
    }
}
