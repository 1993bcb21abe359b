package com.example.voice.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "voice")
public class VoiceProperties {

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Cache cache = new Cache();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final CallSession callSession = new CallSession();

    @NestedConfigurationProperty
    private final HumanControl humanControl = new HumanControl();

    @NestedConfigurationProperty
    private final Broadcast broadcast = new Broadcast();

    @NestedConfigurationProperty
    private final Reconciler reconciler = new Reconciler();

    @NestedConfigurationProperty
    private final Webhook webhook = new Webhook();

    @NestedConfigurationProperty
    private final Retry retry = new Retry();

    public Redis getRedis() {
        return redis;
    }

    public Cache getCache() {
        return cache;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public CallSession getCallSession() {
        return callSession;
    }

    public HumanControl getHumanControl() {
        return humanControl;
    }

    public Broadcast getBroadcast() {
        return broadcast;
    }

    public Reconciler getReconciler() {
        return reconciler;
    }

    public Webhook getWebhook() {
        return webhook;
    }

    public Retry getRetry() {
        return retry;
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys and topics owned by this service.
         */
        private String keyPrefix = "voice";

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    @Validated
    public static class Cache {

        /**
         * Whether conversation context entries are cached in Redis.
         */
        private boolean enabled = true;

        /**
         * Time-to-live of a cached conversation context entry.
         */
        private Duration contextTtl = Duration.ofSeconds(60);

        /**
         * Number of most recent messages used to build a context.
         */
        private int historyWindow = 6;

        /**
         * Number of most recent summaries used to build a context.
         */
        private int summaryWindow = 3;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getContextTtl() {
            return contextTtl;
        }

        public void setContextTtl(Duration contextTtl) {
            this.contextTtl = contextTtl;
        }

        public int getHistoryWindow() {
            return historyWindow;
        }

        public void setHistoryWindow(int historyWindow) {
            this.historyWindow = historyWindow;
        }

        public int getSummaryWindow() {
            return summaryWindow;
        }

        public void setSummaryWindow(int summaryWindow) {
            this.summaryWindow = summaryWindow;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Kafka topic receiving every conversation state change.
         */
        private String eventTopic = "voice.conversation-events";

        /**
         * Kafka topic receiving operator-authored messages awaiting delivery to the customer.
         */
        private String outboundTopic = "voice.outbound-messages";

        public String getEventTopic() {
            return eventTopic;
        }

        public void setEventTopic(String eventTopic) {
            this.eventTopic = eventTopic;
        }

        public String getOutboundTopic() {
            return outboundTopic;
        }

        public void setOutboundTopic(String outboundTopic) {
            this.outboundTopic = outboundTopic;
        }
    }

    @Validated
    public static class CallSession {

        /**
         * Age after which a non-terminal call session is considered abandoned.
         */
        private Duration staleAfter = Duration.ofMinutes(5);

        /**
         * Upper bound for history queries.
         */
        private int maxHistory = 200;

        public Duration getStaleAfter() {
            return staleAfter;
        }

        public void setStaleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
        }

        public int getMaxHistory() {
            return maxHistory;
        }

        public void setMaxHistory(int maxHistory) {
            this.maxHistory = maxHistory;
        }
    }

    @Validated
    public static class HumanControl {

        /**
         * Maximum lifetime of a human control session that is not linked to a call session.
         */
        private Duration maxDuration = Duration.ofHours(2);

        /**
         * Attempts made by a join that keeps losing the insert race to sessions that end immediately.
         */
        private int joinAttempts = 3;

        public Duration getMaxDuration() {
            return maxDuration;
        }

        public void setMaxDuration(Duration maxDuration) {
            this.maxDuration = maxDuration;
        }

        public int getJoinAttempts() {
            return joinAttempts;
        }

        public void setJoinAttempts(int joinAttempts) {
            this.joinAttempts = joinAttempts;
        }
    }

    @Validated
    public static class Broadcast {

        /**
         * Frames buffered per subscriber before the subscriber is considered too slow and dropped.
         */
        private int queueCapacity = 256;

        /**
         * Frames kept per organization and replayed to newly connected clients.
         */
        private int recentCapacity = 20;

        /**
         * Interval between heartbeat frames.
         */
        private Duration heartbeatInterval = Duration.ofSeconds(30);

        /**
         * Relay frames between service instances over a Redis topic.
         */
        private boolean relayEnabled = false;

        /**
         * Longest a single write to a client may take before the client is dropped and the
         * writing thread is interrupted.
         */
        private Duration sendTimeout = Duration.ofSeconds(5);

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getRecentCapacity() {
            return recentCapacity;
        }

        public void setRecentCapacity(int recentCapacity) {
            this.recentCapacity = recentCapacity;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public boolean isRelayEnabled() {
            return relayEnabled;
        }

        public void setRelayEnabled(boolean relayEnabled) {
            this.relayEnabled = relayEnabled;
        }

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }
    }

    @Validated
    public static class Reconciler {

        /**
         * Toggle for the scheduled reconciliation sweep.
         */
        private boolean enabled = true;

        /**
         * Interval between automatic reconciliation sweeps.
         */
        private Duration interval = Duration.ofMinutes(5);

        /**
         * Guard each organization sweep with a Redis lock so only one instance sweeps it at a time.
         */
        private boolean distributedLock = false;

        /**
         * Lease time of the per-organization sweep lock.
         */
        private Duration lockLease = Duration.ofMinutes(2);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public boolean isDistributedLock() {
            return distributedLock;
        }

        public void setDistributedLock(boolean distributedLock) {
            this.distributedLock = distributedLock;
        }

        public Duration getLockLease() {
            return lockLease;
        }

        public void setLockLease(Duration lockLease) {
            this.lockLease = lockLease;
        }
    }

    @Validated
    public static class Webhook {

        /**
         * Hard response budget of the synchronous conversation initiation callback.
         */
        private Duration initiationBudget = Duration.ofSeconds(2);

        public Duration getInitiationBudget() {
            return initiationBudget;
        }

        public void setInitiationBudget(Duration initiationBudget) {
            this.initiationBudget = initiationBudget;
        }
    }

    @Validated
    public static class Retry {

        /**
         * Delay before the first retry of a transient datastore failure.
         */
        private Duration initialInterval = Duration.ofMillis(50);

        /**
         * Factor applied to the delay after each retry.
         */
        private double multiplier = 2.0;

        /**
         * Total attempts, the first one included.
         */
        private int maxAttempts = 3;

        public Duration getInitialInterval() {
            return initialInterval;
        }

        public void setInitialInterval(Duration initialInterval) {
            this.initialInterval = initialInterval;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }
}
