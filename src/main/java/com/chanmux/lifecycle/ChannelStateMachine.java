package com.chanmux.lifecycle;

import com.chanmux.protocol.ReconnectPolicy;
import com.chanmux.shared.model.Channel;
import com.chanmux.shared.model.ChannelStatus;
import com.chanmux.shared.model.ChannelUpdate;

import java.time.Clock;

/**
 * Transition function of the channel status machine. Pure: it reads the current record and the
 * event and returns the update to merge plus the effects to run. Every transition stamps
 * {@code lastSeen}. Terminal records ignore every event; only an explicit create or regenerate
 * moves them on.
 */
public class ChannelStateMachine {

    private final ReconnectPolicy policy;
    private final Clock clock;

    public ChannelStateMachine(ReconnectPolicy policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    public Transition apply(Channel current, LifecycleEvent event) {
        if (current.status().isTerminal()) {
            return Transition.none();
        }
        var now = clock.instant();
        if (event instanceof LifecycleEvent.QrReady qr) {
            return Transition.of(
                    ChannelUpdate.status(ChannelStatus.QRCODE, now).withQrCode(qr.image()),
                    new Effect.ResolvePairing());
        }
        if (event instanceof LifecycleEvent.Connecting) {
            return Transition.of(ChannelUpdate.status(ChannelStatus.CONNECTING, now));
        }
        if (event instanceof LifecycleEvent.Opened) {
            // nobody needs to keep waiting for a QR once the connection is up
            return Transition.of(
                    ChannelUpdate.status(ChannelStatus.CONNECTED, now).withoutQrCode().withReconnectAttempts(0),
                    new Effect.ResolvePairing());
        }
        if (event instanceof LifecycleEvent.Closed closed) {
            var decision = policy.decide(closed.cause(), current.reconnectAttempts());
            return switch (decision.action()) {
                case LOGGED_OUT -> Transition.of(
                        ChannelUpdate.status(ChannelStatus.LOGGED_OUT, now),
                        new Effect.DropSession());
                case RECONNECT -> Transition.of(
                        ChannelUpdate.status(ChannelStatus.RECONNECTING, now)
                                .withReconnectAttempts(decision.attempt()),
                        new Effect.ScheduleReconnect(decision.attempt(), decision.delayMs()));
                case GIVE_UP -> Transition.of(
                        ChannelUpdate.status(ChannelStatus.FAILED, now).withReconnectAttempts(0),
                        new Effect.DropSession());
            };
        }
        throw new IllegalArgumentException("Unhandled lifecycle event: " + event);
    }

    public ReconnectPolicy policy() {
        return policy;
    }
}
