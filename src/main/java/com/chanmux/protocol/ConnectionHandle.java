package com.chanmux.protocol;

import com.chanmux.shared.model.OutboundMessage;

import java.io.IOException;

/**
 * One live connection. Events are delivered to the subscribed listener; events raised before
 * {@link #subscribe} are held back until a listener is present.
 */
public interface ConnectionHandle {

    void subscribe(ConnectionListener listener);

    SendReceipt sendMessage(OutboundMessage message) throws IOException;

    RecipientCheck verifyRecipient(String jid) throws IOException;

    /** Invalidates the credentials on the network side and closes the connection. */
    void logout() throws IOException;

    /** Closes the transport, keeping credentials valid. */
    void end() throws IOException;

    TransportState transportState();

    /** Account id of the authenticated user, or null before pairing completes. */
    String userId();
}
