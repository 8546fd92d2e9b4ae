package com.chanmux.gateway.ws;

import com.chanmux.lifecycle.LifecycleController;
import com.chanmux.shared.model.Channel;
import com.chanmux.shared.model.ChannelStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ChannelEventsWebSocketHandlerTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private LifecycleController lifecycle;
    private ChannelEventsWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        lifecycle = mock(LifecycleController.class);
        handler = new ChannelEventsWebSocketHandler(mapper, lifecycle);
    }

    private WebSocketSession openSession(String id) {
        var session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        handler.afterConnectionEstablished(session);
        return session;
    }

    @Test
    void registersItselfAsListener() {
        verify(lifecycle).addListener(handler);
    }

    @Test
    void broadcastsChannelUpdates() throws Exception {
        var session = openSession("s1");

        handler.onChannelUpdated(new Channel("c1", ChannelStatus.CONNECTED, null, Instant.now(), 0));

        var captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(captor.capture());
        var json = mapper.readTree(captor.getValue().getPayload());
        assertEquals("channel.updated", json.get("type").asText());
        assertEquals("c1", json.at("/channel/channelId").asText());
        assertEquals("CONNECTED", json.at("/channel/status").asText());
    }

    @Test
    void broadcastsRemovals() throws Exception {
        var session = openSession("s1");

        handler.onChannelRemoved("c1");

        var captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(captor.capture());
        var json = mapper.readTree(captor.getValue().getPayload());
        assertEquals("channel.removed", json.get("type").asText());
        assertEquals("c1", json.at("/channel/channelId").asText());
    }

    @Test
    void failingClientsAreDropped() throws Exception {
        var broken = openSession("broken");
        var healthy = openSession("healthy");
        doThrow(new IOException("pipe closed")).when(broken).sendMessage(any());

        handler.onChannelRemoved("c1");

        assertEquals(1, handler.clientCount());
        verify(healthy).sendMessage(any());
    }

    @Test
    void closedClientsStopReceiving() throws Exception {
        var session = openSession("s1");
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        handler.onChannelRemoved("c1");

        verify(session, never()).sendMessage(any());
        assertEquals(0, handler.clientCount());
    }

    @Test
    void stalledClientDoesNotHoldUpBroadcasts() throws Exception {
        var stalled = openSession("stalled");
        var healthy = openSession("healthy");
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        doAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(stalled).sendMessage(any());

        var first = new Thread(() -> handler.onChannelRemoved("a"));
        first.start();
        try {
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertTimeoutPreemptively(Duration.ofSeconds(1), () -> handler.onChannelRemoved("b"));
            verify(healthy, atLeastOnce()).sendMessage(any());
        } finally {
            release.countDown();
            first.join(5_000);
        }
    }
}
