package com.chanmux.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".chanmux", "config.yaml"
    );

    public static ChanMuxConfig load() {
        var override = System.getenv("CHANMUX_CONFIG");
        return load(override != null && !override.isBlank() ? Path.of(override) : DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static ChanMuxConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var storage = (Map<String, Object>) raw.getOrDefault("storage", Map.of());
        var bridge = (Map<String, Object>) raw.getOrDefault("bridge", Map.of());
        var lifecycle = (Map<String, Object>) raw.getOrDefault("lifecycle", Map.of());
        var messaging = (Map<String, Object>) raw.getOrDefault("messaging", Map.of());

        return new ChanMuxConfig(
            Integer.parseInt(envOrDefault("CHANMUX_PORT",
                String.valueOf(server.getOrDefault("port", 3000)))),
            Path.of(envOrDefault("CHANMUX_DATA_DIR",
                String.valueOf(storage.getOrDefault("data-dir", "data/channels")))),
            parseBridgeConfig(bridge),
            parseLifecycleConfig(lifecycle),
            parseMessagingConfig(messaging)
        );
    }

    private static BridgeConfig parseBridgeConfig(Map<String, Object> bridge) {
        var defaults = BridgeConfig.defaults();
        return new BridgeConfig(
            envOrDefault("CHANMUX_BRIDGE_URL", String.valueOf(bridge.getOrDefault("url", defaults.url()))),
            millis(bridge, "connect-timeout", defaults.connectTimeout()),
            millis(bridge, "request-timeout", defaults.requestTimeout()),
            millis(bridge, "keep-alive-interval", defaults.keepAliveInterval()),
            millis(bridge, "qr-timeout", defaults.qrTimeout()),
            String.valueOf(bridge.getOrDefault("browser-name", defaults.browserName())),
            Boolean.TRUE.equals(bridge.getOrDefault("mark-online-on-connect", defaults.markOnlineOnConnect())),
            Boolean.TRUE.equals(bridge.getOrDefault("sync-full-history", defaults.syncFullHistory()))
        );
    }

    private static LifecycleConfig parseLifecycleConfig(Map<String, Object> lifecycle) {
        var defaults = LifecycleConfig.defaults();
        return new LifecycleConfig(
            millis(lifecycle, "pairing-timeout", defaults.pairingTimeout()),
            millis(lifecycle, "settle-delay", defaults.settleDelay()),
            Integer.parseInt(String.valueOf(
                lifecycle.getOrDefault("max-reconnect-attempts", defaults.maxReconnectAttempts()))),
            millis(lifecycle, "reconnect-base-delay", defaults.reconnectBaseDelay()),
            millis(lifecycle, "reconnect-max-delay", defaults.reconnectMaxDelay())
        );
    }

    private static MessagingConfig parseMessagingConfig(Map<String, Object> messaging) {
        var defaults = MessagingConfig.defaults();
        return new MessagingConfig(
            millis(messaging, "min-delay", defaults.minDelay()),
            String.valueOf(messaging.getOrDefault("default-country-code", defaults.defaultCountryCode()))
        );
    }

    private static Duration millis(Map<String, Object> section, String key, Duration fallback) {
        var value = section.get(key);
        if (value == null) return fallback;
        return Duration.ofMillis(Long.parseLong(String.valueOf(value)));
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
