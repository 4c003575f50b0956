package dev.larder.api;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Emitter helpers shared by the streaming endpoints. Sends are synchronized on the emitter since
 * image events arrive from worker threads while progress is still being streamed.
 */
final class SseEvents {

    private static final Logger log = LoggerFactory.getLogger(SseEvents.class);

    private SseEvents() {
        // utility class
    }

    /**
     * @throws IllegalStateException if the client is gone
     */
    static void send(SseEmitter emitter, String eventName, Object payload) {
        synchronized (emitter) {
            try {
                emitter.send(SseEmitter.event().name(eventName).data(payload));
            } catch (IOException e) {
                throw new IllegalStateException("SSE send failed for event: " + eventName, e);
            }
        }
    }

    /**
     * Send a terminal error event and complete the emitter.
     */
    static void sendErrorAndComplete(SseEmitter emitter, String message) {
        try {
            send(emitter, "error", new ErrorEvent(message));
        } catch (IllegalStateException e) {
            log.debug("Error event not delivered: {}", e.getMessage());
        } finally {
            complete(emitter);
        }
    }

    /**
     * Complete the emitter, tolerating a response that is already committed or closed.
     */
    static void complete(SseEmitter emitter) {
        synchronized (emitter) {
            try {
                emitter.complete();
            } catch (IllegalStateException e) {
                log.debug("SSE emitter already completed: {}", e.getMessage());
            }
        }
    }

    record ErrorEvent(String message) {
    }
}
