package com.composeops.dispatch.api;

import com.composeops.core.connection.EventChannel;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * {@link EventChannel} writing named SSE events to an {@link SseEmitter}.
 */
class SseEventChannel implements EventChannel {

    private final SseEmitter emitter;

    SseEventChannel(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(String eventName, Object data) throws IOException {
        try {
            emitter.send(SseEmitter.event()
                    .name(eventName)
                    .data(data != null ? data : ""));
        } catch (IllegalStateException e) {
            // emitter already completed or timed out
            throw new IOException("SSE emitter is closed", e);
        }
    }
}
