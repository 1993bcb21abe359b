package com.example.voice.dto;

import com.example.voice.domain.HumanControlSession;
import com.example.voice.service.JoinResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HumanControlResponse {
    boolean success;
    String status;
    String leadId;
    String currentOwner;
    String message;
    HumanControlSession session;

    public static HumanControlResponse fromJoin(String leadId, JoinResult result) {
        String message = switch (result.status()) {
            case JOINED -> "Joined conversation";
            case ALREADY_OWNED -> "Already controlling this conversation";
            case CONFLICT -> "Conversation is already controlled by " + result.currentOwner();
        };
        return HumanControlResponse.builder()
                .success(result.isSuccess())
                .status(result.status().name().toLowerCase())
                .leadId(leadId)
                .currentOwner(result.currentOwner())
                .message(message)
                .session(result.session())
                .build();
    }
}
