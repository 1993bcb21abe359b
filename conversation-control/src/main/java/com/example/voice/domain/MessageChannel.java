package com.example.voice.domain;

public enum MessageChannel {
    VOICE("Voice"),
    SMS("SMS"),
    SYSTEM("System");

    private final String label;

    MessageChannel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
