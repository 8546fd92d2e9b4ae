package com.chanmux.protocol;

import com.chanmux.auth.CredentialSaver;
import com.chanmux.shared.model.OutboundMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One bridge socket. Requests are correlated to {@code result} frames by id; everything else
 * becomes a {@link ConnectionEvent}.
 */
class BridgeConnection implements ConnectionHandle, WebSocket.Listener {

    private static final Logger log = LoggerFactory.getLogger(BridgeConnection.class);

    private final String channelId;
    private final CredentialSaver saver;
    private final Duration requestTimeout;
    private final AtomicInteger idSeq = new AtomicInteger(1);
    private final ConcurrentMap<Integer, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();
    private final AtomicReference<TransportState> state = new AtomicReference<>(TransportState.CONNECTING);
    private final AtomicBoolean closeReported = new AtomicBoolean();
    private final List<ConnectionEvent> backlog = new ArrayList<>();
    private final StringBuilder partial = new StringBuilder();

    private ConnectionListener listener;
    private volatile WebSocket socket;
    private volatile String userId;

    BridgeConnection(String channelId, CredentialSaver saver, Duration requestTimeout) {
        this.channelId = channelId;
        this.saver = saver;
        this.requestTimeout = requestTimeout;
    }

    void attach(WebSocket socket) {
        this.socket = socket;
        state.compareAndSet(TransportState.CONNECTING, TransportState.OPEN);
    }

    @Override
    public void subscribe(ConnectionListener listener) {
        synchronized (backlog) {
            this.listener = listener;
            backlog.forEach(e -> deliver(listener, e));
            backlog.clear();
        }
    }

    @Override
    public SendReceipt sendMessage(OutboundMessage message) throws IOException {
        var data = request("send", f -> f.put("to", message.to()).put("text", message.text()));
        return new SendReceipt(data.path("id").asText(null), data.path("remoteJid").asText(message.to()));
    }

    @Override
    public RecipientCheck verifyRecipient(String jid) throws IOException {
        var data = request("verify", f -> f.put("jid", jid));
        return new RecipientCheck(data.path("exists").asBoolean(false), data.path("jid").asText(jid));
    }

    @Override
    public void logout() throws IOException {
        try {
            request("logout", f -> {});
        } finally {
            end();
        }
    }

    @Override
    public void end() throws IOException {
        var ws = socket;
        if (ws == null) return;
        if (state.getAndUpdate(s -> s == TransportState.CLOSED ? s : TransportState.CLOSING) == TransportState.CLOSED) {
            return;
        }
        try {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "end").get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            ws.abort();
            throw new IOException("Failed to close bridge socket for " + channelId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ws.abort();
        }
    }

    @Override
    public TransportState transportState() {
        return state.get();
    }

    @Override
    public String userId() {
        return userId;
    }

    // --- WebSocket.Listener ---

    @Override
    public void onOpen(WebSocket webSocket) {
        webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
        partial.append(data);
        if (last) {
            var text = partial.toString();
            partial.setLength(0);
            try {
                dispatch(BridgeFrames.MAPPER.readTree(text));
            } catch (JsonProcessingException e) {
                log.warn("[{}] Dropping malformed bridge frame: {}", channelId, e.getOriginalMessage());
            }
        }
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
        log.debug("[{}] Bridge socket closed ({} {})", channelId, statusCode, reason);
        transportClosed(reason);
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
        log.warn("[{}] Bridge socket error: {}", channelId, error.getMessage());
        transportClosed(error.getMessage());
    }

    void dispatch(JsonNode frame) {
        var type = frame.path("type").asText("");
        if ("result".equals(type)) {
            var future = pending.remove(frame.path("id").asInt(-1));
            if (future != null) future.complete(frame);
            return;
        }
        if ("creds".equals(type)) {
            BridgeFrames.credentials(frame).ifPresent(creds -> {
                var me = creds.creds().path("me").path("id").asText("");
                if (!me.isEmpty()) userId = me;
                saver.save(creds);
            });
        }
        BridgeFrames.toEvent(channelId, frame).ifPresent(event -> {
            if (event instanceof ConnectionEvent.ConnectionUpdate update && update.state() == ConnectionState.CLOSE) {
                closeReported.set(true);
            }
            emit(event);
        });
    }

    void transportClosed(String reason) {
        state.set(TransportState.CLOSED);
        pending.values().forEach(f -> f.complete(null));
        pending.clear();
        if (closeReported.compareAndSet(false, true)) {
            emit(ConnectionEvent.ConnectionUpdate.closed(DisconnectReason.CONNECTION_LOST, reason));
        }
    }

    void sendFrame(ObjectNode frame) throws IOException {
        var ws = socket;
        if (ws == null || state.get() != TransportState.OPEN) {
            throw new IOException("Connection Closed");
        }
        // WebSocket allows one outstanding send at a time
        synchronized (this) {
            try {
                ws.sendText(BridgeFrames.MAPPER.writeValueAsString(frame), true)
                        .get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException | TimeoutException e) {
                throw new IOException("Failed to write bridge frame: " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while writing bridge frame", e);
            }
        }
    }

    private JsonNode request(String type, Consumer<ObjectNode> body) throws IOException {
        int id = idSeq.getAndIncrement();
        var frame = BridgeFrames.request(type, id);
        body.accept(frame);

        var future = new CompletableFuture<JsonNode>();
        pending.put(id, future);
        try {
            sendFrame(frame);
            var response = future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (response == null) {
                throw new IOException("Connection Closed");
            }
            if (!response.path("ok").asBoolean(false)) {
                throw new IOException(response.path("error").asText("Bridge request '" + type + "' failed"));
            }
            return response.path("data");
        } catch (TimeoutException e) {
            throw new IOException("Bridge request '" + type + "' timed out after " + requestTimeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            throw new IOException("Bridge request '" + type + "' failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted during bridge request '" + type + "'", e);
        } finally {
            pending.remove(id);
        }
    }

    // delivery stays under the lock so held events keep their order
    private void emit(ConnectionEvent event) {
        synchronized (backlog) {
            if (listener == null) {
                backlog.add(event);
            } else {
                deliver(listener, event);
            }
        }
    }

    private void deliver(ConnectionListener target, ConnectionEvent event) {
        try {
            target.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("[{}] Listener rejected {}: {}", channelId, event.getClass().getSimpleName(), e.getMessage());
        }
    }
}
