package com.example.voice.dto;

import com.example.voice.domain.HumanControlSession;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HumanControlStatusResponse {
    String leadId;
    boolean underHumanControl;
    String operatorName;
    HumanControlSession session;
}
