package com.example.voice.websocket;

/**
 * Handle returned by {@link RealtimeBroadcastHub#subscribe}. Cancelling twice is harmless.
 */
public interface Subscription {

    String getClientId();

    String getOrganizationId();

    boolean isActive();

    void cancel();
}
