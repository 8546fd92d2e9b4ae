package com.chanmux.auth;

import java.util.List;

public interface CredentialStore {

    /** True if a storage location exists for the channel, even if it holds no credentials yet. */
    boolean exists(String channelId);

    /** Stored credentials, or fresh empty state when nothing was saved. Never null. */
    CredentialState load(String channelId);

    void save(String channelId, CredentialState state);

    void discard(String channelId);

    /** Channel ids that have saved credentials to restore from. */
    List<String> listStored();
}
