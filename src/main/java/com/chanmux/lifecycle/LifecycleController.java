package com.chanmux.lifecycle;

import com.chanmux.protocol.ConnectionHandle;
import com.chanmux.shared.model.Channel;
import com.chanmux.shared.model.HealthCheck;
import com.chanmux.shared.model.PairingResult;

import java.util.List;
import java.util.Optional;

/**
 * Creates, tracks, reconnects and tears down the per-channel connections.
 */
public interface LifecycleController {

    /**
     * Registers a new channel, starts pairing from scratch and waits for the first QR code.
     * On timeout the currently recorded status is returned rather than an error.
     *
     * @throws com.chanmux.shared.error.ChannelAlreadyExistsException if the id is taken
     * @throws com.chanmux.shared.error.PairingEncodeException if the QR code could not be rendered
     */
    PairingResult create(String channelId);

    /**
     * Drops the current connection and credentials and pairs again.
     *
     * @throws com.chanmux.shared.error.ChannelNotFoundException if the channel is unknown
     */
    PairingResult regenerate(String channelId);

    /**
     * Reconnects a channel from its stored credentials without forcing a new pairing.
     *
     * @throws com.chanmux.shared.error.ChannelNotFoundException if nothing is stored for the id
     */
    PairingResult restore(String channelId);

    /**
     * Logs the channel out (best effort) and forgets it.
     *
     * @throws com.chanmux.shared.error.ChannelNotFoundException if the channel is unknown
     */
    void close(String channelId);

    HealthCheck testConnection(String channelId);

    Optional<Channel> getStatus(String channelId);

    List<Channel> listAll();

    boolean isConnected(String channelId);

    /** The live connection of a channel, for sending messages. */
    Optional<ConnectionHandle> connection(String channelId);

    void addListener(ChannelListener listener);
}
