package com.chanmux.gateway.ws;

import com.chanmux.lifecycle.ChannelListener;
import com.chanmux.lifecycle.LifecycleController;
import com.chanmux.shared.model.Channel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes every channel snapshot change to connected WebSocket clients as
 * {@code {"type":"channel.updated","channel":{...}}} or {@code {"type":"channel.removed","channel":{"channelId":..}}}.
 * Incoming text is answered with the full channel list. Each client is wrapped in a
 * {@link ConcurrentWebSocketSessionDecorator}; one that cannot keep up within the send-time or
 * buffer limit is closed and dropped.
 */
@Component
public class ChannelEventsWebSocketHandler extends TextWebSocketHandler implements ChannelListener {

    private static final Logger log = LoggerFactory.getLogger(ChannelEventsWebSocketHandler.class);
    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper mapper;
    private final LifecycleController lifecycle;
    private final Map<String, WebSocketSession> clients = new ConcurrentHashMap<>();

    public ChannelEventsWebSocketHandler(ObjectMapper mapper, LifecycleController lifecycle) {
        this.mapper = mapper;
        this.lifecycle = lifecycle;
        lifecycle.addListener(this);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        clients.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
        log.debug("Status client connected: {}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        clients.remove(session.getId());
        log.debug("Status client disconnected: {} ({})", session.getId(), status);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        var payload = mapper.writeValueAsString(Map.of("type", "channel.list", "channels", lifecycle.listAll()));
        clients.getOrDefault(session.getId(), session).sendMessage(new TextMessage(payload));
    }

    @Override
    public void onChannelUpdated(Channel channel) {
        broadcast(Map.of("type", "channel.updated", "channel", channel));
    }

    @Override
    public void onChannelRemoved(String channelId) {
        broadcast(Map.of("type", "channel.removed", "channel", Map.of("channelId", channelId)));
    }

    int clientCount() {
        return clients.size();
    }

    private void broadcast(Map<String, Object> event) {
        if (clients.isEmpty()) return;
        String payload;
        try {
            payload = mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize channel event: {}", e.getOriginalMessage());
            return;
        }
        var message = new TextMessage(payload);
        clients.forEach((id, session) -> {
            if (!session.isOpen()) {
                clients.remove(id);
                return;
            }
            try {
                session.sendMessage(message);
            } catch (IOException | SessionLimitExceededException e) {
                log.debug("Dropping status client {}: {}", id, e.getMessage());
                clients.remove(id);
            }
        });
    }
}
