package com.example.voice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class JoinHumanControlRequest {

    @NotBlank
    private String leadId;

    @NotBlank
    @Size(max = 120)
    private String operatorName;
}
