package com.chanmux.protocol;

import com.chanmux.auth.CredentialState;
import com.chanmux.shared.config.BridgeConfig;
import com.chanmux.shared.model.OutboundMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BridgeConnectionTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<CredentialState> saved = new CopyOnWriteArrayList<>();
    private final BridgeConnection conn = new BridgeConnection("c1", saved::add, Duration.ofSeconds(2));

    private static JsonNode frame(String json) throws IOException {
        return MAPPER.readTree(json);
    }

    /** Answers every outgoing request frame with the result built by {@code reply}. */
    private WebSocket respondingSocket(Function<JsonNode, String> reply) {
        var ws = mock(WebSocket.class);
        when(ws.sendText(anyString(), eq(true))).thenAnswer(inv -> {
            var request = MAPPER.readTree(inv.getArgument(0, CharSequence.class).toString());
            conn.dispatch(frame(reply.apply(request)));
            return CompletableFuture.completedFuture(ws);
        });
        return ws;
    }

    @Test
    void eventsBeforeSubscribeAreDeliveredInOrder() throws IOException {
        conn.dispatch(frame("{\"type\":\"connection\",\"state\":\"connecting\"}"));
        conn.dispatch(frame("{\"type\":\"qr\",\"code\":\"2@abc\"}"));

        var events = new CopyOnWriteArrayList<ConnectionEvent>();
        conn.subscribe(events::add);
        conn.dispatch(frame("{\"type\":\"connection\",\"state\":\"open\"}"));

        assertThat(events).containsExactly(
                ConnectionEvent.ConnectionUpdate.connecting(),
                new ConnectionEvent.PairingCodeIssued("2@abc"),
                ConnectionEvent.ConnectionUpdate.open());
    }

    @Test
    void closeFrameCarriesDisconnectReason() throws IOException {
        var events = new CopyOnWriteArrayList<ConnectionEvent>();
        conn.subscribe(events::add);
        conn.dispatch(frame("{\"type\":\"connection\",\"state\":\"close\",\"statusCode\":401,\"reason\":\"logged out\"}"));
        conn.transportClosed("bye");

        assertThat(events).containsExactly(
                ConnectionEvent.ConnectionUpdate.closed(DisconnectReason.LOGGED_OUT, "logged out"));
        assertEquals(TransportState.CLOSED, conn.transportState());
    }

    @Test
    void bareTransportCloseIsReportedAsConnectionLost() {
        var events = new CopyOnWriteArrayList<ConnectionEvent>();
        conn.subscribe(events::add);
        conn.transportClosed("reset by peer");
        conn.transportClosed("again");

        assertThat(events).containsExactly(
                ConnectionEvent.ConnectionUpdate.closed(DisconnectReason.CONNECTION_LOST, "reset by peer"));
    }

    @Test
    void credentialFramesAreSavedAndExposeUserId() throws IOException {
        var events = new CopyOnWriteArrayList<ConnectionEvent>();
        conn.subscribe(events::add);
        assertNull(conn.userId());

        conn.dispatch(frame("{\"type\":\"creds\",\"creds\":{\"me\":{\"id\":\"5511999999999:3@s.whatsapp.net\"}}}"));

        assertEquals(1, saved.size());
        assertTrue(saved.get(0).isRegistered());
        assertEquals("5511999999999:3@s.whatsapp.net", conn.userId());
        assertThat(events).hasSize(1).first().isInstanceOf(ConnectionEvent.CredentialsUpdated.class);
    }

    @Test
    void unknownAndMalformedFramesAreIgnored() throws IOException {
        var events = new CopyOnWriteArrayList<ConnectionEvent>();
        conn.subscribe(events::add);
        conn.dispatch(frame("{\"type\":\"presence\"}"));
        conn.dispatch(frame("{\"type\":\"qr\",\"code\":\"\"}"));
        conn.dispatch(frame("{\"type\":\"connection\",\"state\":\"sleeping\"}"));
        assertTrue(events.isEmpty());
    }

    @Test
    void listenerFailureDoesNotBreakDelivery() throws IOException {
        var events = new CopyOnWriteArrayList<ConnectionEvent>();
        conn.subscribe(event -> {
            events.add(event);
            throw new IllegalStateException("listener gone");
        });
        conn.dispatch(frame("{\"type\":\"qr\",\"code\":\"a\"}"));
        conn.dispatch(frame("{\"type\":\"qr\",\"code\":\"b\"}"));
        assertEquals(2, events.size());
    }

    @Test
    void inboundMessagesBecomeEvents() throws IOException {
        var events = new CopyOnWriteArrayList<ConnectionEvent>();
        conn.subscribe(events::add);
        conn.dispatch(frame("{\"type\":\"message\",\"from\":\"5511888888888@s.whatsapp.net\",\"text\":\"hi\",\"fromMe\":false}"));

        var received = (ConnectionEvent.MessageReceived) events.get(0);
        assertEquals("c1", received.message().channelId());
        assertEquals("hi", received.message().text());
        assertFalse(received.message().fromMe());
    }

    @Test
    void sendMessageIsCorrelatedWithResult() throws IOException {
        conn.attach(respondingSocket(req -> {
            assertEquals("send", req.get("type").asText());
            assertEquals("5511999999999@s.whatsapp.net", req.get("to").asText());
            return "{\"type\":\"result\",\"id\":" + req.get("id").asInt()
                    + ",\"ok\":true,\"data\":{\"id\":\"ABC\",\"remoteJid\":\"5511999999999@s.whatsapp.net\"}}";
        }));

        var receipt = conn.sendMessage(new OutboundMessage("5511999999999@s.whatsapp.net", "hello"));

        assertEquals("ABC", receipt.messageId());
        assertEquals("5511999999999@s.whatsapp.net", receipt.remoteJid());
        assertEquals(TransportState.OPEN, conn.transportState());
    }

    @Test
    void verifyRecipientReadsExistsFlag() throws IOException {
        conn.attach(respondingSocket(req -> "{\"type\":\"result\",\"id\":" + req.get("id").asInt()
                + ",\"ok\":true,\"data\":{\"exists\":true,\"jid\":\"5511999999999@s.whatsapp.net\"}}"));

        var check = conn.verifyRecipient("5511999999999@s.whatsapp.net");

        assertTrue(check.exists());
        assertEquals("5511999999999@s.whatsapp.net", check.jid());
    }

    @Test
    void failedResultBecomesIOException() {
        conn.attach(respondingSocket(req -> "{\"type\":\"result\",\"id\":" + req.get("id").asInt()
                + ",\"ok\":false,\"error\":\"not-authorized\"}"));

        var ex = assertThrows(IOException.class, () -> conn.verifyRecipient("x@s.whatsapp.net"));
        assertEquals("not-authorized", ex.getMessage());
    }

    @Test
    void requestsFailOnceTransportIsClosed() {
        var ex = assertThrows(IOException.class, () -> conn.sendMessage(new OutboundMessage("x", "y")));
        assertEquals("Connection Closed", ex.getMessage());

        conn.attach(mock(WebSocket.class));
        conn.transportClosed(null);
        assertThrows(IOException.class, () -> conn.verifyRecipient("x"));
    }

    @Test
    void openFrameCarriesCredentialsAndOptions() {
        var creds = MAPPER.createObjectNode();
        creds.putObject("me").put("id", "me@s.whatsapp.net");
        var frame = BridgeFrames.open("c1", new CredentialState(creds),
                ClientOptions.from(BridgeConfig.defaults()));

        assertEquals("open", frame.get("type").asText());
        assertEquals("c1", frame.get("channelId").asText());
        assertEquals("me@s.whatsapp.net", frame.at("/creds/me/id").asText());
        assertEquals("ChanMux", frame.at("/options/browser").asText());
        assertEquals(40_000, frame.at("/options/qrTimeoutMs").asLong());
    }
}
