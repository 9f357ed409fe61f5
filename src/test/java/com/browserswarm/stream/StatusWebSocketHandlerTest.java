package com.browserswarm.stream;

import com.browserswarm.orchestration.service.SwarmRunService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StatusWebSocketHandlerTest {

    private final StatusHub hub = mock(StatusHub.class);
    private final StatusPublisher publisher = new StatusPublisher(hub);
    private final SwarmRunService runService = mock(SwarmRunService.class);
    private final StatusWebSocketHandler handler = new StatusWebSocketHandler(hub, publisher, runService, new ObjectMapper());
    private final WebSocketSession session = mock(WebSocketSession.class);

    private StatusEvent lastReply() {
        ArgumentCaptor<StatusEvent> captor = ArgumentCaptor.forClass(StatusEvent.class);
        verify(hub, org.mockito.Mockito.atLeastOnce()).sendTo(eq(session), captor.capture());
        return captor.getValue();
    }

    @Test
    void testSnapshotOnConnect() {
        when(runService.snapshot()).thenReturn(Map.of("pool", "ok"));

        handler.afterConnectionEstablished(session);

        verify(hub).register(session);
        StatusEvent reply = lastReply();
        assertEquals("snapshot", reply.type());
        assertEquals(Map.of("pool", "ok"), reply.payload());
    }

    @Test
    void testExecuteSubmitsRun() throws Exception {
        when(runService.submit("Find 3 fintech startups")).thenReturn("run-7");

        handler.handleMessage(session, new TextMessage("{\"type\":\"execute\",\"prompt\":\"Find 3 fintech startups\"}"));

        StatusEvent reply = lastReply();
        assertEquals("status", reply.type());
        assertEquals(Map.of("runId", "run-7", "message", "Accepted"), reply.payload());
    }

    @Test
    void testInvalidJsonIsRejected() throws Exception {
        handler.handleMessage(session, new TextMessage("not json"));

        StatusEvent reply = lastReply();
        assertEquals("error", reply.type());
        assertEquals(Map.of("message", "Invalid JSON"), reply.payload());
        verify(runService, never()).submit(any());
    }

    @Test
    void testUnknownTypeIsRejected() throws Exception {
        handler.handleMessage(session, new TextMessage("{\"type\":\"dance\"}"));

        assertEquals(Map.of("message", "Unknown message type: dance"), lastReply().payload());
    }
}
