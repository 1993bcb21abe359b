package com.example.voice.dto;

import com.example.voice.domain.MessageChannel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class HumanMessageRequest {

    @NotBlank
    private String leadId;

    @NotBlank
    @Size(max = 1600)
    private String content;

    private MessageChannel channel = MessageChannel.SMS;
}
