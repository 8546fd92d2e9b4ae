package com.chanmux.gateway;

import com.chanmux.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.chanmux")
public class ChanMuxApp {

    private static final Logger log = LoggerFactory.getLogger(ChanMuxApp.class);

    public static void main(String[] args) {
        var config = ConfigLoader.load();
        var app = new SpringApplication(ChanMuxApp.class);
        app.setDefaultProperties(Map.of("server.port", config.serverPort()));
        app.run(args);
        log.info("ChanMux listening on port {}, credentials under {}", config.serverPort(), config.dataDir().toAbsolutePath());
    }
}
