package com.chanmux.gateway.http;

import com.chanmux.messaging.MessageService;
import com.chanmux.messaging.NumberCheck;
import com.chanmux.messaging.SentMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/messages")
public class MessageController {

    private static final Logger log = LoggerFactory.getLogger(MessageController.class);

    private final MessageService messages;

    public MessageController(MessageService messages) {
        this.messages = messages;
    }

    public record SendTextRequest(String channelId, String to, String message) {}

    public record CheckNumberRequest(String channelId, String number) {}

    @PostMapping("/text")
    public ApiResponse<SentMessage> sendText(@RequestBody SendTextRequest body) {
        if (isBlank(body.channelId()) || isBlank(body.to()) || isBlank(body.message())) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "MISSING_REQUIRED_FIELDS",
                    "channelId, to and message are required");
        }
        if (!messages.isValidNumber(body.to())) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "INVALID_NUMBER", "Invalid phone number");
        }
        var sent = messages.sendText(body.channelId(), body.to(), body.message());
        log.info("[{}] Message sent via API to {}", body.channelId(), body.to());
        return ApiResponse.ok(sent);
    }

    @PostMapping("/check-number")
    public ApiResponse<NumberCheck> checkNumber(@RequestBody CheckNumberRequest body) {
        if (isBlank(body.channelId()) || isBlank(body.number())) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "MISSING_REQUIRED_FIELDS",
                    "channelId and number are required");
        }
        return ApiResponse.ok(messages.checkNumber(body.channelId(), body.number()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
