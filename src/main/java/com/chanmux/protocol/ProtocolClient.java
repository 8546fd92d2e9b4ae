package com.chanmux.protocol;

import com.chanmux.auth.CredentialSaver;
import com.chanmux.auth.CredentialState;

import java.io.IOException;

/**
 * Opens connections to the messaging network. Authentication, encryption and the wire
 * protocol live behind this interface.
 */
public interface ProtocolClient {

    ConnectionHandle open(String channelId, CredentialState credentials, CredentialSaver saver,
                          ClientOptions options) throws IOException;
}
