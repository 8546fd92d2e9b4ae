package com.chanmux.shared.model;

public record HealthCheck(boolean healthy, String reason) {

    public static HealthCheck ok() {
        return new HealthCheck(true, "Connection OK");
    }

    public static HealthCheck unhealthy(String reason) {
        return new HealthCheck(false, reason);
    }
}
