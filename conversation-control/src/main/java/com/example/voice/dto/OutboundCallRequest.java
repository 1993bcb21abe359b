package com.example.voice.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OutboundCallRequest {

    @NotBlank
    private String leadId;

    @NotBlank
    private String externalId;

    private String providerAgentId;
}
