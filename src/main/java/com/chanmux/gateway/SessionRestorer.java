package com.chanmux.gateway;

import com.chanmux.auth.CredentialStore;
import com.chanmux.lifecycle.LifecycleController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Reconnects every channel that has stored credentials when the application starts. */
@Component
public class SessionRestorer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SessionRestorer.class);

    private final CredentialStore credentials;
    private final LifecycleController lifecycle;

    public SessionRestorer(CredentialStore credentials, LifecycleController lifecycle) {
        this.credentials = credentials;
        this.lifecycle = lifecycle;
    }

    @Override
    public void run(ApplicationArguments args) {
        restoreAll();
    }

    public int restoreAll() {
        var stored = credentials.listStored();
        if (stored.isEmpty()) {
            log.info("No stored sessions to restore");
            return 0;
        }
        log.info("Found {} stored session(s) to restore", stored.size());
        int restored = 0;
        for (var channelId : stored) {
            try {
                lifecycle.restore(channelId);
                restored++;
                log.info("[{}] Session restored", channelId);
            } catch (RuntimeException e) {
                log.error("[{}] Failed to restore session: {}", channelId, e.getMessage());
            }
        }
        return restored;
    }
}
