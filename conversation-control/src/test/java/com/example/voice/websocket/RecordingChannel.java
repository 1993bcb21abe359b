package com.example.voice.websocket;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

class RecordingChannel implements OutboundChannel {

    private final List<BroadcastFrame> frames = new CopyOnWriteArrayList<>();
    private final AtomicInteger heartbeats = new AtomicInteger();
    private final AtomicInteger closes = new AtomicInteger();
    private final AtomicInteger blockedSends = new AtomicInteger();
    private volatile boolean open = true;
    private volatile boolean failing;
    private volatile CountDownLatch gate;

    @Override
    public void send(BroadcastFrame frame) throws IOException {
        CountDownLatch current = gate;
        if (current != null) {
            blockedSends.incrementAndGet();
            try {
                current.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", ex);
            }
        }
        if (failing) {
            throw new IOException("broken pipe");
        }
        frames.add(frame);
    }

    @Override
    public void sendHeartbeat() throws IOException {
        if (failing) {
            throw new IOException("broken pipe");
        }
        heartbeats.incrementAndGet();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        closes.incrementAndGet();
    }

    void failSends() {
        failing = true;
    }

    void disconnect() {
        open = false;
    }

    void block(CountDownLatch latch) {
        gate = latch;
    }

    List<BroadcastFrame> frames() {
        return frames;
    }

    List<BroadcastFrame> framesOfType(String type) {
        return frames.stream().filter(frame -> type.equals(frame.getType())).toList();
    }

    int heartbeats() {
        return heartbeats.get();
    }

    int closes() {
        return closes.get();
    }

    boolean awaitBlockedSend(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (blockedSends.get() == 0) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }

    boolean awaitFrames(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (frames.size() < count) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }
}
