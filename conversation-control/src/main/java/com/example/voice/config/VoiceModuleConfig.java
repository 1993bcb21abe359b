package com.example.voice.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the voice properties and shapes the application's {@code ObjectMapper}, which Spring
 * Boot builds from the customized builder. Cached contexts, Kafka payloads and Socket.IO frames
 * all go through that mapper, so timestamps are ISO-8601 strings everywhere.
 */
@Configuration
@EnableConfigurationProperties({VoiceProperties.class, VoiceSecurityProperties.class})
public class VoiceModuleConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer voiceJacksonCustomizer() {
        return builder -> builder
                .modulesToInstall(JavaTimeModule.class)
                .featuresToDisable(
                        SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                        DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
