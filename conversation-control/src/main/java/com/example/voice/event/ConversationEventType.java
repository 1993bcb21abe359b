package com.example.voice.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConversationEventType {
    CALL_INITIATED("call_initiated"),
    CALL_STATUS_CHANGED("call_status_changed"),
    CALL_COMPLETED("call_completed"),
    SESSION_AUTO_CLOSED("session_auto_closed"),
    CONVERSATION_ADDED("conversation_added"),
    LIVE_TRANSCRIPT("live_transcript"),
    SUMMARY_ADDED("summary_added"),
    SMS_RECEIVED("sms_received"),
    SMS_RECEIVED_HUMAN_QUEUE("sms_received_human_queue"),
    HUMAN_CONTROL_JOINED("human_control_joined"),
    HUMAN_CONTROL_LEFT("human_control_left"),
    HUMAN_CONTROL_FORCE_ENDED("human_control_force_ended"),
    HUMAN_MESSAGE_SENT("human_message_sent"),
    LEAD_UPDATED("lead_updated");

    private final String wireName;

    ConversationEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
