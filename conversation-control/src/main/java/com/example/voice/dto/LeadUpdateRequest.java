package com.example.voice.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class LeadUpdateRequest {

    @Size(max = 200)
    private String customerName;

    @Email
    private String email;

    @Size(max = 40)
    private String status;
}
