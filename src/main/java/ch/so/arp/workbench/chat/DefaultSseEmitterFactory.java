package ch.so.arp.workbench.chat;

import java.time.Duration;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Creates emitters bounded by a fixed timeout. A zero timeout means the
 * emitter never times out.
 */
class DefaultSseEmitterFactory implements SseEmitterFactory {

    private final long timeoutMillis;

    DefaultSseEmitterFactory(Duration timeout) {
        this.timeoutMillis = timeout.toMillis();
    }

    @Override
    public SseEmitter create() {
        return new SseEmitter(timeoutMillis);
    }
}
