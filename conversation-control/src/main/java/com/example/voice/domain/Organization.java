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
public class Organization implements Serializable {

    private String id;
    private String name;
    private String phoneNumber;
    private Instant createdAt;
}
