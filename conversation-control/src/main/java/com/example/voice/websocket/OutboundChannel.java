package com.example.voice.websocket;

import java.io.IOException;

/**
 * Transport-specific push target of one dashboard client. Calls for one channel never
 * overlap: the hub drains each subscriber on at most one thread at a time.
 */
public interface OutboundChannel {

    void send(BroadcastFrame frame) throws IOException;

    void sendHeartbeat() throws IOException;

    boolean isOpen();

    void close();
}
