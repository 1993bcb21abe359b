package com.example.voice.websocket;

import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Server-sent events transport. Frames are written as JSON data events named after the frame
 * type; heartbeats are SSE comments.
 */
@Slf4j
public class SseOutboundChannel implements OutboundChannel {

    private final SseEmitter emitter;
    private volatile boolean open = true;
    private volatile Runnable onClose = () -> { };

    public SseOutboundChannel(SseEmitter emitter) {
        this.emitter = emitter;
        emitter.onCompletion(this::closed);
        emitter.onTimeout(this::closed);
        emitter.onError(ex -> {
            log.debug("SSE stream failed: {}", ex.getMessage());
            closed();
        });
    }

    /**
     * Callback run once the client goes away, whichever side ended the stream.
     */
    public void onClose(Runnable callback) {
        this.onClose = callback;
    }

    @Override
    public void send(BroadcastFrame frame) throws IOException {
        emitter.send(SseEmitter.event()
                .name(frame.getType())
                .data(frame, MediaType.APPLICATION_JSON));
    }

    @Override
    public void sendHeartbeat() throws IOException {
        emitter.send(SseEmitter.event().comment("ping"));
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        if (open) {
            open = false;
            emitter.complete();
        }
    }

    private void closed() {
        open = false;
        onClose.run();
    }
}
