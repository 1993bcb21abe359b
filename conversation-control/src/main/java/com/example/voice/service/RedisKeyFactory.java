package com.example.voice.service;

import com.example.voice.config.VoiceProperties;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final VoiceProperties voiceProperties;

    public RedisKeyFactory(VoiceProperties voiceProperties) {
        this.voiceProperties = voiceProperties;
    }

    private String prefix() {
        return voiceProperties.getRedis().getKeyPrefix();
    }

    public String contextKey(String organizationId, String leadId) {
        return "%s:ctx:%s:%s".formatted(prefix(), organizationId, leadId);
    }

    public String broadcastTopicName() {
        return "%s:broadcast".formatted(prefix());
    }

    public String reconcileLockKey(String organizationId) {
        return "%s:reconcile:%s:lock".formatted(prefix(), organizationId);
    }
}
