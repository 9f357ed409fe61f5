package com.browserswarm.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StatusHubTest {

    private final StatusHub hub = new StatusHub(new ObjectMapper().registerModule(new JavaTimeModule()));

    private static WebSocketSession session(String id, boolean open) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(open);
        return session;
    }

    private static StatusEvent event() {
        return new StatusEvent(1, Instant.parse("2026-01-01T00:00:00Z"), "pool-status", Map.of("idle", 3));
    }

    @Test
    void testBroadcastReachesOpenSessions() throws Exception {
        WebSocketSession first = session("a", true);
        WebSocketSession second = session("b", true);
        hub.register(first);
        hub.register(second);

        hub.broadcast(event());

        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(first).sendMessage(captor.capture());
        verify(second).sendMessage(any(TextMessage.class));
        assertTrue(captor.getValue().getPayload().contains("\"type\":\"pool-status\""));
        assertEquals(2, hub.sessionCount());
    }

    @Test
    void testFailedSessionsArePruned() throws Exception {
        WebSocketSession healthy = session("a", true);
        WebSocketSession broken = session("b", true);
        WebSocketSession closed = session("c", false);
        doThrow(new IOException("broken pipe")).when(broken).sendMessage(any());
        hub.register(healthy);
        hub.register(broken);
        hub.register(closed);

        hub.broadcast(event());

        assertEquals(1, hub.sessionCount());
        verify(healthy).sendMessage(any(TextMessage.class));
    }

    @Test
    void testRemove() {
        WebSocketSession session = session("a", true);
        hub.register(session);
        hub.remove(session);
        assertEquals(0, hub.sessionCount());
    }
}
