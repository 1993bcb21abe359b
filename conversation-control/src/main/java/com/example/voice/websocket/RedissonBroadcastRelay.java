package com.example.voice.websocket;

import com.example.voice.event.ConversationEvent;
import com.example.voice.event.ConversationEventListener;
import com.example.voice.service.RedisKeyFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.codec.TypedJsonJacksonCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Shares frames with the hubs of other instances over a Redis topic, so a dashboard
 * connected to any instance sees events produced on all of them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "voice.broadcast.relay-enabled", havingValue = "true")
public class RedissonBroadcastRelay implements ConversationEventListener {

    private final String originId = UUID.randomUUID().toString();

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final RealtimeBroadcastHub hub;
    private final ObjectMapper objectMapper;

    private RTopic topic;
    private int listenerId;

    @PostConstruct
    public void subscribe() {
        topic = redissonClient.getTopic(
                keyFactory.broadcastTopicName(), new TypedJsonJacksonCodec(RelayedFrame.class, objectMapper));
        listenerId = topic.addListener(RelayedFrame.class, (channel, relayed) -> {
            if (relayed == null || originId.equals(relayed.getOriginId())) {
                return;
            }
            hub.publish(relayed.getFrame());
        });
        log.info("Broadcast relay {} listening on {}", originId, keyFactory.broadcastTopicName());
    }

    @PreDestroy
    public void shutdown() {
        if (topic != null) {
            topic.removeListener(listenerId);
        }
    }

    @Override
    public void onConversationEvent(ConversationEvent event) {
        if (topic == null) {
            return;
        }
        topic.publishAsync(new RelayedFrame(originId, BroadcastFrame.from(event)))
                .whenComplete((receivers, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to relay {} event {}", event.getType(), event.getEventId(), ex);
                    }
                });
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RelayedFrame {
        private String originId;
        private BroadcastFrame frame;
    }
}
