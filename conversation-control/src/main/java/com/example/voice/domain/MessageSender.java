package com.example.voice.domain;

public enum MessageSender {
    USER("Customer"),
    AGENT("Assistant"),
    HUMAN_AGENT("Human Agent"),
    SYSTEM("System");

    private final String label;

    MessageSender(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
