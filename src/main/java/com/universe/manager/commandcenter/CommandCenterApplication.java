package com.universe.manager.commandcenter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application for the Executive Command Center monitor.
 *
 * This application polls the backend system-health endpoint on a fixed interval,
 * retries failures with exponential backoff, and serves the latest state to the
 * command center dashboard.
 */
@Slf4j
@SpringBootApplication
public class CommandCenterApplication {

    public static void main(String[] args) {
        log.info("Starting Command Center Monitor...");
        SpringApplication.run(CommandCenterApplication.class, args);
        log.info("Command Center Monitor started successfully");
    }
}
