package com.chanmux.auth;

@FunctionalInterface
public interface CredentialSaver {
    void save(CredentialState state);
}
