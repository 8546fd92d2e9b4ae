package com.chanmux.protocol;

import com.chanmux.auth.CredentialState;
import com.chanmux.shared.model.InboundMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Optional;

/**
 * JSON frames exchanged with the protocol bridge.
 *
 * <pre>
 * out: {"type":"open","channelId":..,"creds":{..},"options":{..}}
 *      {"type":"send","id":n,"to":jid,"text":..}
 *      {"type":"verify","id":n,"jid":..}
 *      {"type":"logout","id":n}
 * in:  {"type":"qr","code":..}
 *      {"type":"connection","state":"connecting|open|close","statusCode":n,"reason":..}
 *      {"type":"creds","creds":{..}}
 *      {"type":"message","from":..,"text":..,"fromMe":bool}
 *      {"type":"result","id":n,"ok":bool,"data":{..},"error":..}
 * </pre>
 */
final class BridgeFrames {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private BridgeFrames() {}

    static ObjectNode open(String channelId, CredentialState credentials, ClientOptions options) {
        var frame = MAPPER.createObjectNode();
        frame.put("type", "open");
        frame.put("channelId", channelId);
        frame.set("creds", credentials.creds());
        var opts = frame.putObject("options");
        opts.put("browser", options.browserName());
        opts.put("markOnlineOnConnect", options.markOnlineOnConnect());
        opts.put("syncFullHistory", options.syncFullHistory());
        opts.put("connectTimeoutMs", options.connectTimeout().toMillis());
        opts.put("keepAliveIntervalMs", options.keepAliveInterval().toMillis());
        opts.put("qrTimeoutMs", options.qrTimeout().toMillis());
        return frame;
    }

    static ObjectNode request(String type, int id) {
        var frame = MAPPER.createObjectNode();
        frame.put("type", type);
        frame.put("id", id);
        return frame;
    }

    /**
     * Maps an inbound frame to a connection event. Results, credential snapshots and unknown
     * frame types produce no event here.
     */
    static Optional<ConnectionEvent> toEvent(String channelId, JsonNode frame) {
        var type = frame.path("type").asText("");
        switch (type) {
            case "qr":
                var code = frame.path("code").asText("");
                return code.isEmpty() ? Optional.empty() : Optional.of(new ConnectionEvent.PairingCodeIssued(code));
            case "connection":
                return connectionUpdate(frame);
            case "creds":
                return credentials(frame).map(ConnectionEvent.CredentialsUpdated::new);
            case "message":
                return Optional.of(new ConnectionEvent.MessageReceived(new InboundMessage(
                        channelId,
                        frame.path("from").asText(null),
                        frame.path("text").asText(""),
                        frame.path("fromMe").asBoolean(false),
                        Instant.now())));
            default:
                return Optional.empty();
        }
    }

    static Optional<CredentialState> credentials(JsonNode frame) {
        var creds = frame.get("creds");
        return creds instanceof ObjectNode obj ? Optional.of(new CredentialState(obj)) : Optional.empty();
    }

    private static Optional<ConnectionEvent> connectionUpdate(JsonNode frame) {
        switch (frame.path("state").asText("")) {
            case "connecting":
                return Optional.of(ConnectionEvent.ConnectionUpdate.connecting());
            case "open":
                return Optional.of(ConnectionEvent.ConnectionUpdate.open());
            case "close":
                var cause = frame.hasNonNull("statusCode")
                        ? DisconnectReason.fromCode(frame.get("statusCode").asInt())
                        : DisconnectReason.UNKNOWN;
                return Optional.of(ConnectionEvent.ConnectionUpdate.closed(cause, frame.path("reason").asText(null)));
            default:
                return Optional.empty();
        }
    }
}
