package com.example.voice.websocket;

import com.example.voice.event.ConversationEvent;
import com.example.voice.event.ConversationEventListener;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class BroadcastEventBridge implements ConversationEventListener {

    private final RealtimeBroadcastHub hub;

    @Override
    public void onConversationEvent(ConversationEvent event) {
        hub.publish(BroadcastFrame.from(event));
    }
}
