package com.chanmux.observability;

import com.chanmux.channels.ChannelRegistry;
import com.chanmux.shared.model.Channel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class ChannelMetrics {

    private final MeterRegistry registry;

    public ChannelMetrics() {
        this(new SimpleMeterRegistry());
    }

    public ChannelMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter pairingTimeouts() {
        return Counter.builder("chanmux.pairing.timeouts").register(registry);
    }

    public Counter reconnectsScheduled() {
        return Counter.builder("chanmux.reconnects.scheduled").register(registry);
    }

    public Counter channelsFailed() {
        return Counter.builder("chanmux.channels.failed").register(registry);
    }

    public Counter channelsLoggedOut() {
        return Counter.builder("chanmux.channels.logged_out").register(registry);
    }

    public void trackConnected(ChannelRegistry channels) {
        Gauge.builder("chanmux.channels.connected", channels,
                        c -> c.list().stream().filter(Channel::isConnected).count())
                .register(registry);
    }

    public double connected() {
        var gauge = registry.find("chanmux.channels.connected").gauge();
        return gauge != null ? gauge.value() : 0;
    }
}
