package com.chanmux.lifecycle;

import com.chanmux.protocol.DisconnectReason;
import com.chanmux.protocol.ReconnectPolicy;
import com.chanmux.shared.model.Channel;
import com.chanmux.shared.model.ChannelStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ChannelStateMachineTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2026-01-01T00:00:05Z");

    private final ChannelStateMachine fsm =
            new ChannelStateMachine(new ReconnectPolicy(), Clock.fixed(T1, ZoneOffset.UTC));

    private static Channel channel(ChannelStatus status, String qr, int attempts) {
        return new Channel("c1", status, qr, T0, attempts);
    }

    @Test
    void qrReadyStoresImageAndResolvesPairing() {
        var t = fsm.apply(Channel.created("c1", T0), new LifecycleEvent.QrReady("data:image/png;base64,AAA"));
        var next = Channel.created("c1", T0).merge(t.update());
        assertEquals(ChannelStatus.QRCODE, next.status());
        assertEquals("data:image/png;base64,AAA", next.qrCode());
        assertEquals(T1, next.lastSeen());
        assertThat(t.effects()).containsExactly(new Effect.ResolvePairing());
    }

    @Test
    void connectingOnlyChangesStatus() {
        var current = channel(ChannelStatus.QRCODE, "qr", 2);
        var next = current.merge(fsm.apply(current, new LifecycleEvent.Connecting()).update());
        assertEquals(ChannelStatus.CONNECTING, next.status());
        assertEquals("qr", next.qrCode());
        assertEquals(2, next.reconnectAttempts());
    }

    @Test
    void openClearsQrAndResetsAttempts() {
        var current = channel(ChannelStatus.RECONNECTING, "qr", 3);
        var t = fsm.apply(current, new LifecycleEvent.Opened());
        var next = current.merge(t.update());
        assertEquals(ChannelStatus.CONNECTED, next.status());
        assertNull(next.qrCode());
        assertEquals(0, next.reconnectAttempts());
        assertThat(t.effects()).containsExactly(new Effect.ResolvePairing());
    }

    @Test
    void loggedOutDropsSessionWithoutReconnect() {
        var current = channel(ChannelStatus.CONNECTED, null, 0);
        var t = fsm.apply(current, new LifecycleEvent.Closed(DisconnectReason.LOGGED_OUT));
        assertEquals(ChannelStatus.LOGGED_OUT, current.merge(t.update()).status());
        assertThat(t.effects()).containsExactly(new Effect.DropSession());
    }

    @Test
    void closeSchedulesNextAttempt() {
        var current = channel(ChannelStatus.RECONNECTING, null, 1);
        var t = fsm.apply(current, new LifecycleEvent.Closed(DisconnectReason.CONNECTION_LOST));
        var next = current.merge(t.update());
        assertEquals(ChannelStatus.RECONNECTING, next.status());
        assertEquals(2, next.reconnectAttempts());
        assertThat(t.effects()).containsExactly(new Effect.ScheduleReconnect(2, 6_000));
    }

    @Test
    void closeAfterLastAttemptFails() {
        var current = channel(ChannelStatus.RECONNECTING, null, 5);
        var t = fsm.apply(current, new LifecycleEvent.Closed(DisconnectReason.CONNECTION_CLOSED));
        var next = current.merge(t.update());
        assertEquals(ChannelStatus.FAILED, next.status());
        assertEquals(0, next.reconnectAttempts());
        assertThat(t.effects()).containsExactly(new Effect.DropSession());
    }

    @Test
    void sixClosesWithoutOpenEndInFailed() {
        var current = channel(ChannelStatus.CONNECTED, null, 0);
        for (int i = 1; i <= 5; i++) {
            current = current.merge(fsm.apply(current, new LifecycleEvent.Closed(DisconnectReason.CONNECTION_LOST)).update());
            assertEquals(ChannelStatus.RECONNECTING, current.status());
            assertEquals(i, current.reconnectAttempts());
        }
        current = current.merge(fsm.apply(current, new LifecycleEvent.Closed(DisconnectReason.CONNECTION_LOST)).update());
        assertEquals(ChannelStatus.FAILED, current.status());
    }

    @Test
    void terminalStatusesIgnoreEveryEvent() {
        for (var status : new ChannelStatus[] {ChannelStatus.FAILED, ChannelStatus.LOGGED_OUT}) {
            var current = channel(status, null, 0);
            for (var event : new LifecycleEvent[] {
                    new LifecycleEvent.Closed(DisconnectReason.CONNECTION_LOST),
                    new LifecycleEvent.Closed(DisconnectReason.LOGGED_OUT),
                    new LifecycleEvent.Opened(),
                    new LifecycleEvent.Connecting(),
                    new LifecycleEvent.QrReady("img")}) {
                var t = fsm.apply(current, event);
                assertTrue(t.isNone(), status + " reacted to " + event);
                assertNull(t.update());
                assertThat(t.effects()).isEmpty();
            }
        }
    }
}
