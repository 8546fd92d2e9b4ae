package com.chanmux.sessions;

import com.chanmux.auth.CredentialSaver;
import com.chanmux.protocol.ConnectionHandle;

import java.time.Instant;

/**
 * Live connection backing a channel. {@code generation} identifies the connection attempt
 * that produced it.
 */
public record Session(
    String channelId,
    ConnectionHandle handle,
    CredentialSaver saver,
    long generation,
    Instant createdAt
) {}
