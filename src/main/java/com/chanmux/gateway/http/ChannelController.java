package com.chanmux.gateway.http;

import com.chanmux.lifecycle.LifecycleController;
import com.chanmux.shared.error.ChannelNotFoundException;
import com.chanmux.shared.model.Channel;
import com.chanmux.shared.model.ChannelStatus;
import com.chanmux.shared.model.PairingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.regex.Pattern;

@RestController
@RequestMapping("/channels")
public class ChannelController {

    private static final Logger log = LoggerFactory.getLogger(ChannelController.class);
    private static final Pattern CHANNEL_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final LifecycleController lifecycle;

    public ChannelController(LifecycleController lifecycle) {
        this.lifecycle = lifecycle;
    }

    public record CreateChannelRequest(String channelId) {}

    public record ChannelList(List<Channel> channels, int total) {}

    public record ChannelHealth(String channelId, ChannelStatus status, boolean healthy, String reason) {}

    @PostMapping
    public ResponseEntity<ApiResponse<Object>> create(@RequestBody(required = false) CreateChannelRequest body) {
        var channelId = body != null ? body.channelId() : null;
        if (channelId == null || channelId.isBlank()) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "MISSING_CHANNEL_ID", "channelId is required");
        }
        validate(channelId);
        var existing = lifecycle.getStatus(channelId);
        if (existing.isPresent()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(ApiResponse.error("CHANNEL_ALREADY_EXISTS", "Channel already exists", existing.get()));
        }
        PairingResult result = lifecycle.create(channelId);
        log.info("[{}] Channel created via API ({})", channelId, result.status());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(result));
    }

    @GetMapping
    public ApiResponse<ChannelList> list() {
        var channels = lifecycle.listAll();
        return ApiResponse.ok(new ChannelList(channels, channels.size()));
    }

    @GetMapping("/{channelId}/status")
    public ApiResponse<Channel> status(@PathVariable String channelId) {
        return ApiResponse.ok(require(channelId));
    }

    @PostMapping("/{channelId}/qrcode")
    public ApiResponse<PairingResult> regenerate(@PathVariable String channelId) {
        var channel = require(channelId);
        if (channel.isConnected()) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "CHANNEL_ALREADY_CONNECTED", "Channel is already connected");
        }
        var result = lifecycle.regenerate(channelId);
        log.info("[{}] QR code regenerated via API", channelId);
        return ApiResponse.ok(result);
    }

    @GetMapping("/{channelId}/health")
    public ApiResponse<ChannelHealth> health(@PathVariable String channelId) {
        var channel = require(channelId);
        var check = lifecycle.testConnection(channelId);
        return ApiResponse.ok(new ChannelHealth(channelId, channel.status(), check.healthy(), check.reason()));
    }

    @DeleteMapping("/{channelId}")
    public ApiResponse<Void> close(@PathVariable String channelId) {
        require(channelId);
        lifecycle.close(channelId);
        log.info("[{}] Channel closed via API", channelId);
        return ApiResponse.message("Channel " + channelId + " disconnected");
    }

    private Channel require(String channelId) {
        return lifecycle.getStatus(channelId).orElseThrow(() -> new ChannelNotFoundException(channelId));
    }

    private static void validate(String channelId) {
        if (!CHANNEL_ID.matcher(channelId).matches() || channelId.startsWith(".")) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "INVALID_CHANNEL_ID",
                    "channelId may only contain letters, digits, '.', '_' and '-'");
        }
    }
}
