package com.chanmux.gateway;

import com.chanmux.auth.CredentialStore;
import com.chanmux.auth.FileCredentialStore;
import com.chanmux.auth.PairingCoordinator;
import com.chanmux.auth.ZxingQrEncoder;
import com.chanmux.channels.ChannelRegistry;
import com.chanmux.lifecycle.DefaultLifecycleController;
import com.chanmux.messaging.MessageService;
import com.chanmux.observability.ChannelMetrics;
import com.chanmux.protocol.BridgeProtocolClient;
import com.chanmux.protocol.ClientOptions;
import com.chanmux.sessions.SessionStore;
import com.chanmux.shared.config.ChanMuxConfig;
import com.chanmux.shared.config.ConfigLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the lifecycle core from {@code ~/.chanmux/config.yaml}. The core classes carry no
 * Spring annotations; they are built here.
 */
@Configuration
public class GatewayConfig {

    @Bean
    public ChanMuxConfig chanMuxConfig() {
        return ConfigLoader.load();
    }

    @Bean
    public ChannelMetrics channelMetrics() {
        return new ChannelMetrics();
    }

    @Bean
    public CredentialStore credentialStore(ChanMuxConfig config) {
        return new FileCredentialStore(config.dataDir());
    }

    @Bean(destroyMethod = "shutdown")
    public DefaultLifecycleController lifecycleController(ChanMuxConfig config, CredentialStore credentials,
                                                          ChannelMetrics metrics) {
        return new DefaultLifecycleController(
                new ChannelRegistry(),
                new SessionStore(),
                new PairingCoordinator(),
                credentials,
                new BridgeProtocolClient(config.bridge()),
                new ZxingQrEncoder(),
                config.lifecycle(),
                ClientOptions.from(config.bridge()),
                metrics);
    }

    @Bean
    public MessageService messageService(DefaultLifecycleController lifecycle, ChanMuxConfig config) {
        return new MessageService(lifecycle, config.messaging());
    }
}
