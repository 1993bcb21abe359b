package com.example.voice.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Lead implements Serializable {

    public static final String DEFAULT_STATUS = "new";

    private String id;
    private String organizationId;
    private String phoneNumber;
    private String customerName;
    private String email;
    private String status;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastContactAt;
}
