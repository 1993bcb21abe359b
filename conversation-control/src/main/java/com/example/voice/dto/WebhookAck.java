package com.example.voice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookAck {

    private boolean received;
    private String reason;
    private String callSessionId;

    public static WebhookAck received(String callSessionId) {
        return new WebhookAck(true, null, callSessionId);
    }

    public static WebhookAck ignored(String reason) {
        return new WebhookAck(true, reason, null);
    }

    public static WebhookAck rejected(String reason) {
        return new WebhookAck(false, reason, null);
    }
}
