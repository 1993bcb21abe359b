package com.example.voice.event;

public interface ConversationEventListener {

    void onConversationEvent(ConversationEvent event);
}
