package com.example.voice.config;

import com.example.voice.event.ConversationEvent;
import com.example.voice.event.OutboundMessageCommand;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, ConversationEvent> conversationEventProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties());
    }

    @Bean
    public KafkaTemplate<String, ConversationEvent> conversationEventKafkaTemplate(
            ProducerFactory<String, ConversationEvent> conversationEventProducerFactory) {
        return new KafkaTemplate<>(conversationEventProducerFactory);
    }

    @Bean
    public ProducerFactory<String, OutboundMessageCommand> outboundMessageProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties());
    }

    @Bean
    public KafkaTemplate<String, OutboundMessageCommand> outboundMessageKafkaTemplate(
            ProducerFactory<String, OutboundMessageCommand> outboundMessageProducerFactory) {
        return new KafkaTemplate<>(outboundMessageProducerFactory);
    }

    @Bean
    public NewTopic conversationEventTopic(VoiceProperties voiceProperties) {
        return TopicBuilder.name(voiceProperties.getKafka().getEventTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic outboundMessageTopic(VoiceProperties voiceProperties) {
        return TopicBuilder.name(voiceProperties.getKafka().getOutboundTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }
}
