package com.chanmux.sessions;

import com.chanmux.protocol.ConnectionHandle;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class SessionStoreTest {

    private static Session session(String id, long generation) {
        return new Session(id, mock(ConnectionHandle.class), state -> {}, generation, Instant.now());
    }

    @Test
    void installReturnsDisplacedSession() {
        var store = new SessionStore();
        var first = session("a", 1);
        var second = session("a", 2);

        assertTrue(store.install(first).isEmpty());
        assertSame(first, store.install(second).orElseThrow());
        assertSame(second, store.get("a").orElseThrow());
        assertEquals(1, store.size());
    }

    @Test
    void conditionalRemoveIgnoresReplacedSession() {
        var store = new SessionStore();
        var old = session("a", 1);
        var current = session("a", 2);
        store.install(old);
        store.install(current);

        assertFalse(store.remove(old));
        assertSame(current, store.get("a").orElseThrow());
        assertTrue(store.remove(current));
        assertTrue(store.get("a").isEmpty());
    }

    @Test
    void removeByIdReturnsSession() {
        var store = new SessionStore();
        var s = session("a", 1);
        store.install(s);
        store.install(session("b", 1));

        assertSame(s, store.remove("a").orElseThrow());
        assertTrue(store.remove("a").isEmpty());
        assertEquals(1, store.all().size());
    }
}
