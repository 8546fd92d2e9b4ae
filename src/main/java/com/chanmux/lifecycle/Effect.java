package com.chanmux.lifecycle;

/** Side effects requested by a state transition, carried out by the controller. */
public sealed interface Effect {

    record ResolvePairing() implements Effect {}

    record DropSession() implements Effect {}

    record ScheduleReconnect(int attempt, long delayMs) implements Effect {}
}
