package com.example.voice.domain;

public enum CallDirection {
    INBOUND,
    OUTBOUND
}
