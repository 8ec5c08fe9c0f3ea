package com.universe.manager.commandcenter.polling;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Ties the polling session to the application context: started on startup, cancelled
 * on shutdown so no background work outlives the context.
 */
@Slf4j
@Component
public class PollingLifecycle {

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final RefreshCoordinator refreshCoordinator;
    private final boolean enabled;

    public PollingLifecycle(
            RefreshCoordinator refreshCoordinator,
            @Value("${command-center.polling.enabled:true}") boolean enabled
    ) {
        this.refreshCoordinator = refreshCoordinator;
        this.enabled = enabled;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Command center polling disabled");
            return;
        }
        refreshCoordinator.start();
    }

    @PreDestroy
    public void stop() {
        refreshCoordinator.stop();
        try {
            if (!refreshCoordinator.awaitTermination(SHUTDOWN_TIMEOUT)) {
                log.warn("Polling thread still busy after {}s; it will exit once its current fetch returns",
                        SHUTDOWN_TIMEOUT.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
