package ch.so.arp.workbench.chat;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Creates the {@link SseEmitter} backing a streamed chat response. Lets tests
 * capture the emitter handed to the controller.
 */
@FunctionalInterface
public interface SseEmitterFactory {

    SseEmitter create();
}
