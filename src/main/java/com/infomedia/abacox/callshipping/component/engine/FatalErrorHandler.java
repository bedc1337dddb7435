package com.infomedia.abacox.callshipping.component.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stops the process after an unrecoverable state store failure. On the next start the engine
 * resumes from the persisted checkpoints, or from the source watermark if the store was lost.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class FatalErrorHandler {

    private final ConfigurableApplicationContext applicationContext;
    private final AtomicBoolean stopping = new AtomicBoolean();

    public void fatal(String message, Throwable cause) {
        log.error("FATAL: {}. Shutting down the engine.", message, cause);
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        Thread exitThread = new Thread(() -> System.exit(SpringApplication.exit(applicationContext, () -> 1)),
                "fatal-shutdown");
        exitThread.setDaemon(false);
        exitThread.start();
    }

    public boolean isStopping() {
        return stopping.get();
    }
}
