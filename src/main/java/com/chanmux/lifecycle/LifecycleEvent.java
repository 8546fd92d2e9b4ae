package com.chanmux.lifecycle;

import com.chanmux.protocol.DisconnectReason;

/** Inputs of {@link ChannelStateMachine}, already stripped of protocol detail. */
public sealed interface LifecycleEvent {

    record QrReady(String image) implements LifecycleEvent {}

    record Connecting() implements LifecycleEvent {}

    record Opened() implements LifecycleEvent {}

    record Closed(DisconnectReason cause) implements LifecycleEvent {}
}
