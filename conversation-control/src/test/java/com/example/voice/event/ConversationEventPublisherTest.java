package com.example.voice.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.voice.config.AsyncConfig;
import com.example.voice.config.VoiceProperties;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class ConversationEventPublisherTest {

    private final CountDownLatch brokerDown = new CountDownLatch(1);
    private final List<ConversationEvent> received = new CopyOnWriteArrayList<>();
    private final ConversationEventListener recorder = received::add;

    @SuppressWarnings("unchecked")
    private final KafkaTemplate<String, ConversationEvent> eventTemplate = mock(KafkaTemplate.class);

    @SuppressWarnings("unchecked")
    private final KafkaTemplate<String, OutboundMessageCommand> outboundTemplate = mock(KafkaTemplate.class);

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        brokerDown.countDown();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void publishReturnsWhileTheProducerIsStuckOnMetadata() {
        stallEventSends();
        ConversationEventPublisher publisher = publisher(1, 100);

        long started = System.nanoTime();
        for (int i = 0; i < 5; i++) {
            publisher.publish(ConversationEventType.CALL_COMPLETED, "org-1", "lead-1", Map.of("callSessionId", "cs-" + i));
        }
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(elapsedMillis).isLessThan(500);
        assertThat(received).hasSize(5);
        verify(eventTemplate, timeout(1000)).send(eq("voice.conversation-events"), eq("org-1:lead-1"), any(ConversationEvent.class));
    }

    @Test
    void fullBacklogShedsEventsWithoutFailingTheCaller() {
        stallEventSends();
        ConversationEventPublisher publisher = publisher(1, 1);

        assertThatCode(() -> {
            for (int i = 0; i < 4; i++) {
                publisher.publish(ConversationEventType.SMS_RECEIVED, "org-1", "lead-1", null);
            }
        }).doesNotThrowAnyException();

        assertThat(received).hasSize(4);
        verify(eventTemplate, timeout(1000).times(1)).send(anyString(), anyString(), any(ConversationEvent.class));
    }

    @Test
    void failingListenerDoesNotStopDelivery() {
        when(eventTemplate.send(anyString(), anyString(), any(ConversationEvent.class)))
                .thenReturn(new CompletableFuture<>());
        ConversationEventListener broken = mock(ConversationEventListener.class);
        doThrow(new IllegalStateException("listener down")).when(broken).onConversationEvent(any());
        executor = new AsyncConfig().eventPublishExecutor(1, 10);
        ConversationEventPublisher publisher = new ConversationEventPublisher(
                List.of(broken, recorder), eventTemplate, outboundTemplate, new VoiceProperties(), executor);

        ConversationEvent event = publisher.publish(ConversationEventType.CALL_INITIATED, "org-1", null, Map.of());

        assertThat(received).containsExactly(event);
        verify(eventTemplate, timeout(1000)).send("voice.conversation-events", "org-1", event);
    }

    @Test
    void outboundCommandIsSentOffTheCallerThread() {
        when(outboundTemplate.send(anyString(), anyString(), any(OutboundMessageCommand.class)))
                .thenAnswer(invocation -> {
                    brokerDown.await(5, TimeUnit.SECONDS);
                    return new CompletableFuture<>();
                });
        ConversationEventPublisher publisher = publisher(1, 10);
        OutboundMessageCommand command = OutboundMessageCommand.builder()
                .organizationId("org-1")
                .leadId("lead-1")
                .messageId("msg-1")
                .content("On my way")
                .build();

        long started = System.nanoTime();
        publisher.publishOutbound(command);

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(500);
        verify(outboundTemplate, timeout(1000).times(1)).send("voice.outbound-messages", "org-1:lead-1", command);
    }

    private void stallEventSends() {
        when(eventTemplate.send(anyString(), anyString(), any(ConversationEvent.class)))
                .thenAnswer(invocation -> {
                    brokerDown.await(5, TimeUnit.SECONDS);
                    return new CompletableFuture<>();
                });
    }

    private ConversationEventPublisher publisher(int poolSize, int backlog) {
        executor = new AsyncConfig().eventPublishExecutor(poolSize, backlog);
        return new ConversationEventPublisher(
                List.of(recorder), eventTemplate, outboundTemplate, new VoiceProperties(), executor);
    }
}
