package com.example.voice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.Value;

@Value
public class ConversationInitiationResponse {

    public static final String TYPE = "conversation_initiation_client_data";

    String type;

    @JsonProperty("dynamic_variables")
    Map<String, String> dynamicVariables;

    public static ConversationInitiationResponse of(Map<String, String> dynamicVariables) {
        return new ConversationInitiationResponse(TYPE, dynamicVariables);
    }
}
