package com.chanmux.sessions;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** At most one live session per channel id. */
public class SessionStore {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public Optional<Session> get(String channelId) {
        return Optional.ofNullable(sessions.get(channelId));
    }

    /** Installs the session and returns the one it displaced, if any. */
    public Optional<Session> install(Session session) {
        return Optional.ofNullable(sessions.put(session.channelId(), session));
    }

    public Optional<Session> remove(String channelId) {
        return Optional.ofNullable(sessions.remove(channelId));
    }

    /** Removes the session only if it is still the installed one. */
    public boolean remove(Session session) {
        return sessions.remove(session.channelId(), session);
    }

    public int size() {
        return sessions.size();
    }

    public Collection<Session> all() {
        return List.copyOf(sessions.values());
    }
}
