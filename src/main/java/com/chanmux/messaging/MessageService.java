package com.chanmux.messaging;

import com.chanmux.lifecycle.LifecycleController;
import com.chanmux.protocol.ConnectionHandle;
import com.chanmux.shared.config.MessagingConfig;
import com.chanmux.shared.error.ChanMuxException;
import com.chanmux.shared.error.ChannelNotConnectedException;
import com.chanmux.shared.error.ChannelNotFoundException;
import com.chanmux.shared.error.InvalidRecipientException;
import com.chanmux.shared.model.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Outbound text over a connected channel. Messages on one channel are spaced at least
 * {@code minDelay} apart.
 */
public class MessageService {

    private static final Logger log = LoggerFactory.getLogger(MessageService.class);

    private final LifecycleController lifecycle;
    private final RecipientFormatter formatter;
    private final Duration minDelay;
    private final Clock clock;
    private final ConcurrentMap<String, Long> nextSlot = new ConcurrentHashMap<>();

    public MessageService(LifecycleController lifecycle, MessagingConfig config) {
        this(lifecycle, config, Clock.systemUTC());
    }

    public MessageService(LifecycleController lifecycle, MessagingConfig config, Clock clock) {
        this.lifecycle = lifecycle;
        this.formatter = new RecipientFormatter(config.defaultCountryCode());
        this.minDelay = config.minDelay();
        this.clock = clock;
    }

    public SentMessage sendText(String channelId, String to, String text) {
        var handle = connectedHandle(channelId);
        if (handle.userId() == null) {
            log.error("[{}] Connection has no authenticated user", channelId);
            throw new ChannelNotConnectedException(channelId);
        }

        throttle(channelId);
        var jid = formatter.toJid(to);
        log.debug("[{}] Recipient {} -> {}", channelId, to, jid);
        try {
            var check = handle.verifyRecipient(jid);
            if (!check.exists()) {
                throw new InvalidRecipientException(to);
            }
            var receipt = handle.sendMessage(new OutboundMessage(check.jid(), text));
            log.info("[{}] Message {} sent to {}", channelId, receipt.messageId(), check.jid());
            return new SentMessage(receipt.messageId(), check.jid(), text);
        } catch (IOException e) {
            var message = String.valueOf(e.getMessage());
            if (message.contains("not-authorized") || message.contains("Connection Closed")) {
                throw new ChannelNotConnectedException(channelId, e);
            }
            log.error("[{}] Failed to send message: {}", channelId, message);
            throw new ChanMuxException("SEND_FAILED", "Failed to send message: " + message, e);
        }
    }

    /** Verification failures are reported as a number that does not exist. */
    public NumberCheck checkNumber(String channelId, String number) {
        var handle = connectedHandle(channelId);
        var jid = formatter.toJid(number);
        try {
            var check = handle.verifyRecipient(jid);
            return new NumberCheck(check.exists(), check.jid() != null ? check.jid() : jid);
        } catch (IOException e) {
            log.warn("[{}] Number check for {} failed: {}", channelId, number, e.getMessage());
            return new NumberCheck(false, null);
        }
    }

    public boolean isValidNumber(String number) {
        return formatter.isValid(number);
    }

    private ConnectionHandle connectedHandle(String channelId) {
        if (lifecycle.getStatus(channelId).isEmpty()) {
            throw new ChannelNotFoundException(channelId);
        }
        if (!lifecycle.isConnected(channelId)) {
            throw new ChannelNotConnectedException(channelId);
        }
        return lifecycle.connection(channelId)
                .orElseThrow(() -> new ChannelNotConnectedException(channelId));
    }

    /** Reserves the channel's next send slot atomically and waits for it. */
    private void throttle(String channelId) {
        long now = clock.millis();
        long gap = minDelay.toMillis();
        long slot = nextSlot.merge(channelId, now, (reserved, ignored) -> Math.max(now, reserved + gap));
        long remaining = slot - now;
        if (remaining <= 0) return;
        try {
            Thread.sleep(remaining);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChanMuxException("SEND_FAILED", "Interrupted while waiting to send", e);
        }
    }
}
