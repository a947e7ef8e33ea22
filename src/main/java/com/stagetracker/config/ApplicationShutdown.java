package com.stagetracker.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fire-once shutdown trigger for the exit endpoint. Closing the context
 * runs the move processor's shutdown hook.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApplicationShutdown {
    private final ConfigurableApplicationContext context;
    private final AtomicBoolean requested = new AtomicBoolean(false);

    /**
     * Close the application on a separate thread so the calling request
     * can still complete its response.
     *
     * @return false if shutdown was already requested
     */
    public boolean request() {
        if (!requested.compareAndSet(false, true)) {
            return false;
        }
        log.info("Initiate graceful termination");
        Thread closer = new Thread(() -> {
            context.close();
            log.info("Gracefully terminated");
        }, "shutdown");
        closer.start();
        return true;
    }
}
