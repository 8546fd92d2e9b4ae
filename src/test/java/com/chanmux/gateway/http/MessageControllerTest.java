package com.chanmux.gateway.http;

import com.chanmux.messaging.MessageService;
import com.chanmux.messaging.NumberCheck;
import com.chanmux.messaging.SentMessage;
import com.chanmux.shared.error.ChannelNotConnectedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class MessageControllerTest {

    private MessageService messages;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        messages = mock(MessageService.class);
        mvc = MockMvcBuilders.standaloneSetup(new MessageController(messages), new HealthController())
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void sendsText() throws Exception {
        when(messages.isValidNumber("11999998888")).thenReturn(true);
        when(messages.sendText("c1", "11999998888", "hi"))
                .thenReturn(new SentMessage("MSG1", "5511999998888@s.whatsapp.net", "hi"));

        mvc.perform(post("/messages/text").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channelId\":\"c1\",\"to\":\"11999998888\",\"message\":\"hi\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.messageId").value("MSG1"))
                .andExpect(jsonPath("$.data.to").value("5511999998888@s.whatsapp.net"));
    }

    @Test
    void missingFieldsAreRejected() throws Exception {
        mvc.perform(post("/messages/text").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channelId\":\"c1\",\"to\":\"11999998888\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MISSING_REQUIRED_FIELDS"));
        verify(messages, never()).sendText(anyString(), anyString(), anyString());
    }

    @Test
    void invalidNumberIsRejected() throws Exception {
        when(messages.isValidNumber("123")).thenReturn(false);

        mvc.perform(post("/messages/text").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channelId\":\"c1\",\"to\":\"123\",\"message\":\"hi\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_NUMBER"));
    }

    @Test
    void disconnectedChannelIsBadRequest() throws Exception {
        when(messages.isValidNumber(anyString())).thenReturn(true);
        when(messages.sendText("c1", "11999998888", "hi")).thenThrow(new ChannelNotConnectedException("c1"));

        mvc.perform(post("/messages/text").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channelId\":\"c1\",\"to\":\"11999998888\",\"message\":\"hi\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("CHANNEL_NOT_CONNECTED"));
    }

    @Test
    void checksNumber() throws Exception {
        when(messages.checkNumber("c1", "11999998888"))
                .thenReturn(new NumberCheck(true, "5511999998888@s.whatsapp.net"));

        mvc.perform(post("/messages/check-number").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channelId\":\"c1\",\"number\":\"11999998888\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.exists").value(true));
    }

    @Test
    void processHealthIsReported() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("OK"))
                .andExpect(jsonPath("$.data.javaVersion").exists());

        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.name").value("ChanMux"));
    }
}
