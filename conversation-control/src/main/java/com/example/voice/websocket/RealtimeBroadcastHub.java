package com.example.voice.websocket;

import com.example.voice.config.VoiceProperties;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Fans frames out to the dashboard clients of an organization.
 *
 * <p>Each subscriber owns a bounded queue that is drained on the broadcast pool, one drain at
 * a time per subscriber. Publishing only offers to those queues, so it never waits on a
 * client. A subscriber whose queue overflows, whose send fails or whose channel reports
 * closed is dropped. Delivery is best-effort; clients reload authoritative state over REST.
 *
 * <p>A write that outlives the configured send timeout gets its subscriber dropped and its
 * pool thread interrupted, so stalled clients cannot hold the broadcast pool.
 */
@Slf4j
@Component
public class RealtimeBroadcastHub {

    private final ConcurrentMap<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Deque<BroadcastFrame>> recentFrames = new ConcurrentHashMap<>();
    private final VoiceProperties voiceProperties;
    private final Executor broadcastExecutor;

    public RealtimeBroadcastHub(
            VoiceProperties voiceProperties, @Qualifier("broadcastExecutor") Executor broadcastExecutor) {
        this.voiceProperties = voiceProperties;
        this.broadcastExecutor = broadcastExecutor;
    }

    /**
     * Registers a client. A client id that is already connected has its older channel closed.
     * The client first receives a {@code connected} frame and then the organization's recent
     * frames.
     */
    public Subscription subscribe(String clientId, String organizationId, OutboundChannel channel) {
        if (!StringUtils.hasText(clientId) || !StringUtils.hasText(organizationId) || channel == null) {
            throw new IllegalArgumentException("clientId, organizationId and channel are required");
        }
        Subscriber subscriber = new Subscriber(
                clientId, organizationId, channel, Math.max(voiceProperties.getBroadcast().getQueueCapacity(), 1));
        Subscriber previous = subscribers.put(clientId, subscriber);
        if (previous != null) {
            drop(previous, "replaced by a new connection");
        }

        List<BroadcastFrame> replay = recentSnapshot(organizationId);
        enqueue(subscriber, BroadcastFrame.control(BroadcastFrame.CONNECTED, organizationId, Map.of(
                "clientId", clientId,
                "replayed", replay.size())));
        for (BroadcastFrame frame : replay) {
            enqueue(subscriber, frame);
        }
        log.info("Dashboard client {} subscribed to organization {}", clientId, organizationId);
        return subscriber;
    }

    public void publish(BroadcastFrame frame) {
        if (frame == null || !StringUtils.hasText(frame.getOrganizationId())) {
            return;
        }
        remember(frame);
        for (Subscriber subscriber : subscribers.values()) {
            if (subscriber.organizationId.equals(frame.getOrganizationId())) {
                enqueue(subscriber, frame);
            }
        }
    }

    @Scheduled(
            initialDelayString = "#{T(java.time.Duration).parse('${voice.broadcast.heartbeat-interval:PT30S}').toMillis()}",
            fixedDelayString = "#{T(java.time.Duration).parse('${voice.broadcast.heartbeat-interval:PT30S}').toMillis()}")
    public void heartbeat() {
        for (Subscriber subscriber : subscribers.values()) {
            if (!subscriber.channel.isOpen()) {
                drop(subscriber, "channel closed");
                continue;
            }
            enqueue(subscriber, BroadcastFrame.control(BroadcastFrame.HEARTBEAT, subscriber.organizationId, null));
        }
    }

    @Scheduled(
            initialDelayString = "#{T(java.time.Duration).parse('${voice.broadcast.send-check-interval:PT1S}').toMillis()}",
            fixedDelayString = "#{T(java.time.Duration).parse('${voice.broadcast.send-check-interval:PT1S}').toMillis()}")
    public void expireStalledSends() {
        Duration sendTimeout = voiceProperties.getBroadcast().getSendTimeout();
        if (sendTimeout == null || sendTimeout.isZero() || sendTimeout.isNegative()) {
            return;
        }
        long now = System.nanoTime();
        for (Subscriber subscriber : subscribers.values()) {
            if (subscriber.abandonSendOlderThan(now - sendTimeout.toNanos())) {
                drop(subscriber, "send exceeded " + sendTimeout);
            }
        }
    }

    public int subscriberCount(String organizationId) {
        int count = 0;
        for (Subscriber subscriber : subscribers.values()) {
            if (subscriber.organizationId.equals(organizationId)) {
                count++;
            }
        }
        return count;
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    List<BroadcastFrame> recentSnapshot(String organizationId) {
        Deque<BroadcastFrame> ring = recentFrames.get(organizationId);
        if (ring == null) {
            return List.of();
        }
        synchronized (ring) {
            return new ArrayList<>(ring);
        }
    }

    private void remember(BroadcastFrame frame) {
        int capacity = voiceProperties.getBroadcast().getRecentCapacity();
        if (capacity <= 0) {
            return;
        }
        Deque<BroadcastFrame> ring = recentFrames.computeIfAbsent(frame.getOrganizationId(), key -> new ArrayDeque<>());
        synchronized (ring) {
            ring.addLast(frame);
            while (ring.size() > capacity) {
                ring.removeFirst();
            }
        }
    }

    private void enqueue(Subscriber subscriber, BroadcastFrame frame) {
        if (!subscriber.active) {
            return;
        }
        if (!subscriber.queue.offer(frame)) {
            drop(subscriber, "outbound queue full");
            return;
        }
        scheduleDrain(subscriber);
    }

    private void scheduleDrain(Subscriber subscriber) {
        if (!subscriber.draining.compareAndSet(false, true)) {
            return;
        }
        try {
            broadcastExecutor.execute(() -> drain(subscriber));
        } catch (RejectedExecutionException ex) {
            subscriber.draining.set(false);
            drop(subscriber, "broadcast pool saturated");
        }
    }

    private void drain(Subscriber subscriber) {
        try {
            BroadcastFrame frame;
            while (subscriber.active && (frame = subscriber.queue.poll()) != null) {
                subscriber.sendStarted();
                try {
                    if (frame.isHeartbeat()) {
                        subscriber.channel.sendHeartbeat();
                    } else {
                        subscriber.channel.send(frame);
                    }
                } finally {
                    subscriber.sendFinished();
                }
            }
        } catch (IOException | RuntimeException ex) {
            log.debug("Send to dashboard client {} failed: {}", subscriber.clientId, ex.getMessage());
            drop(subscriber, "send failed");
        } finally {
            // an expired send may have left the interrupt flag on this pool thread
            Thread.interrupted();
            subscriber.draining.set(false);
        }
        if (subscriber.active && !subscriber.queue.isEmpty()) {
            scheduleDrain(subscriber);
        }
    }

    private void drop(Subscriber subscriber, String reason) {
        if (!subscriber.deactivate()) {
            return;
        }
        subscribers.remove(subscriber.clientId, subscriber);
        subscriber.queue.clear();
        try {
            subscriber.channel.close();
        } catch (RuntimeException ex) {
            log.debug("Closing channel of dashboard client {} failed", subscriber.clientId, ex);
        }
        log.info("Dropped dashboard client {} of organization {}: {}",
                subscriber.clientId, subscriber.organizationId, reason);
    }

    private final class Subscriber implements Subscription {

        private final String clientId;
        private final String organizationId;
        private final OutboundChannel channel;
        private final BlockingQueue<BroadcastFrame> queue;
        private final AtomicBoolean draining = new AtomicBoolean();
        private volatile boolean active = true;
        private Thread sender;
        private long sendStartedAt;

        private Subscriber(String clientId, String organizationId, OutboundChannel channel, int capacity) {
            this.clientId = clientId;
            this.organizationId = organizationId;
            this.channel = channel;
            this.queue = new ArrayBlockingQueue<>(capacity);
        }

        private synchronized void sendStarted() {
            sender = Thread.currentThread();
            sendStartedAt = System.nanoTime();
        }

        private synchronized void sendFinished() {
            sender = null;
        }

        /**
         * Interrupts the in-flight write if it started before {@code deadline}. The interrupt is
         * only delivered while the write is still registered, so it cannot hit a later task.
         */
        private synchronized boolean abandonSendOlderThan(long deadline) {
            if (sender == null || sendStartedAt - deadline > 0) {
                return false;
            }
            sender.interrupt();
            sender = null;
            return true;
        }

        private synchronized boolean deactivate() {
            if (!active) {
                return false;
            }
            active = false;
            return true;
        }

        @Override
        public String getClientId() {
            return clientId;
        }

        @Override
        public String getOrganizationId() {
            return organizationId;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void cancel() {
            drop(this, "unsubscribed");
        }
    }
}
