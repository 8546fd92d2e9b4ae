package com.chanmux.protocol;

import com.chanmux.auth.CredentialSaver;
import com.chanmux.auth.CredentialState;
import com.chanmux.shared.config.BridgeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Talks to an external protocol bridge over a WebSocket, one socket per channel.
 * The bridge performs authentication and the wire protocol; this side only relays frames.
 */
public class BridgeProtocolClient implements ProtocolClient {

    private static final Logger log = LoggerFactory.getLogger(BridgeProtocolClient.class);

    private final BridgeConfig config;
    private final HttpClient http;

    public BridgeProtocolClient(BridgeConfig config) {
        this.config = config;
        this.http = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    @Override
    public ConnectionHandle open(String channelId, CredentialState credentials, CredentialSaver saver,
                                 ClientOptions options) throws IOException {
        var uri = URI.create(config.url() + (config.url().contains("?") ? "&" : "?") + "channel=" + channelId);
        var connection = new BridgeConnection(channelId, saver, config.requestTimeout());
        try {
            var socket = http.newWebSocketBuilder()
                    .connectTimeout(config.connectTimeout())
                    .buildAsync(uri, connection)
                    .get(config.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
            connection.attach(socket);
            connection.sendFrame(BridgeFrames.open(channelId, credentials, options));
        } catch (TimeoutException e) {
            throw new IOException("Timed out connecting to protocol bridge at " + config.url(), e);
        } catch (ExecutionException e) {
            throw new IOException("Failed to connect to protocol bridge at " + config.url(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while connecting to protocol bridge", e);
        }
        log.debug("[{}] Bridge socket open at {}", channelId, uri);
        return connection;
    }
}
