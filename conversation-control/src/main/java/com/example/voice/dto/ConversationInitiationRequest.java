package com.example.voice.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConversationInitiationRequest {

    @JsonProperty("caller_id")
    private String callerId;

    @JsonProperty("called_number")
    private String calledNumber;

    @JsonProperty("conversation_id")
    private String conversationId;

    @JsonProperty("call_sid")
    private String callSid;

    @JsonProperty("agent_id")
    private String agentId;
}
