package com.chanmux.protocol;

import com.chanmux.auth.CredentialState;
import com.chanmux.shared.model.InboundMessage;

public sealed interface ConnectionEvent {

    /** A raw pairing payload to be shown to the user as a QR code. */
    record PairingCodeIssued(String code) implements ConnectionEvent {}

    record ConnectionUpdate(ConnectionState state, DisconnectReason cause, String detail)
            implements ConnectionEvent {

        public static ConnectionUpdate connecting() {
            return new ConnectionUpdate(ConnectionState.CONNECTING, null, null);
        }

        public static ConnectionUpdate open() {
            return new ConnectionUpdate(ConnectionState.OPEN, null, null);
        }

        public static ConnectionUpdate closed(DisconnectReason cause, String detail) {
            return new ConnectionUpdate(ConnectionState.CLOSE, cause, detail);
        }
    }

    record CredentialsUpdated(CredentialState credentials) implements ConnectionEvent {}

    record MessageReceived(InboundMessage message) implements ConnectionEvent {}
}
