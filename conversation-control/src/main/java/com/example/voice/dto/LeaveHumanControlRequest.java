package com.example.voice.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class LeaveHumanControlRequest {

    @NotBlank
    private String leadId;
}
