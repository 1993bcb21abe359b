package com.example.voice.controller;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.voice.config.VoiceSecurityProperties;
import com.example.voice.dto.ConversationInitiationResponse;
import com.example.voice.dto.WebhookAck;
import com.example.voice.service.WebhookIngestionService;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(WebhookController.class)
class WebhookControllerTest {

    private static final String TWIML = "<?xml version=\"1.0\" encoding=\"UTF-8\"?><Response></Response>";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WebhookIngestionService ingestionService;

    @MockBean
    private VoiceSecurityProperties securityProperties;

    @Test
    void initiationAnswersWithDynamicVariables() throws Exception {
        String body = "{\"caller_id\":\"+15551230001\",\"called_number\":\"+15550000000\"}";
        when(ingestionService.handleInitiation(body))
                .thenReturn(ConversationInitiationResponse.of(Map.of("customer_name", "Dana")));

        mockMvc.perform(post("/api/webhooks/conversation-initiation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value(ConversationInitiationResponse.TYPE))
                .andExpect(jsonPath("$.dynamic_variables.customer_name").value("Dana"));
    }

    @Test
    void malformedEventIsAcknowledged() throws Exception {
        when(ingestionService.handleConversationEvent("{oops")).thenReturn(WebhookAck.rejected("malformed_payload"));

        mockMvc.perform(post("/api/webhooks/conversation-events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{oops"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(false))
                .andExpect(jsonPath("$.reason").value("malformed_payload"));
    }

    @Test
    void callStatusReadsFormFields() throws Exception {
        when(ingestionService.handleCallStatus("CA123", "completed", "42")).thenReturn(WebhookAck.received("cs-1"));

        mockMvc.perform(post("/api/webhooks/call-status")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("CallSid", "CA123")
                        .param("CallStatus", "completed")
                        .param("CallDuration", "42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.callSessionId").value("cs-1"));
    }

    @Test
    void incomingSmsAnswersWithTwiml() throws Exception {
        when(ingestionService.handleIncomingSms("+15551230001", "+15550000000", "Hello", "SM1")).thenReturn(TWIML);

        mockMvc.perform(post("/api/webhooks/sms/incoming")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("From", "+15551230001")
                        .param("To", "+15550000000")
                        .param("Body", "Hello")
                        .param("MessageSid", "SM1"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_XML))
                .andExpect(content().string(TWIML));

        verify(ingestionService).handleIncomingSms("+15551230001", "+15550000000", "Hello", "SM1");
    }
}
