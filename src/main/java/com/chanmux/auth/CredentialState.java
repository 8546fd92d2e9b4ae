package com.chanmux.auth;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Authentication material for one channel. The content is opaque to everything except the
 * protocol client; only {@link #isRegistered()} looks inside.
 */
public record CredentialState(ObjectNode creds) {

    public CredentialState {
        creds = creds != null ? creds.deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    public static CredentialState fresh() {
        return new CredentialState(null);
    }

    /** True once pairing completed and the account id was recorded. */
    public boolean isRegistered() {
        return !creds.path("me").path("id").asText("").isEmpty();
    }
}
