package com.chanmux.protocol;

public record ReconnectDecision(Action action, int attempt, long delayMs) {

    public enum Action {
        RECONNECT,
        LOGGED_OUT,
        GIVE_UP
    }

    public static ReconnectDecision reconnect(int attempt, long delayMs) {
        return new ReconnectDecision(Action.RECONNECT, attempt, delayMs);
    }

    public static ReconnectDecision loggedOut() {
        return new ReconnectDecision(Action.LOGGED_OUT, 0, 0);
    }

    public static ReconnectDecision giveUp() {
        return new ReconnectDecision(Action.GIVE_UP, 0, 0);
    }

    public boolean shouldReconnect() {
        return action == Action.RECONNECT;
    }
}
