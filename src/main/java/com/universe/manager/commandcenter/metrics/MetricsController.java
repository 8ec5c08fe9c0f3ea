package com.universe.manager.commandcenter.metrics;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoint exposing polling engine metrics.
 *
 * Used by dashboards, debugging tools, and tests.
 */
@RestController
@RequiredArgsConstructor
public class MetricsController {

    private final Metrics metrics;

    @GetMapping("/metrics")
    public MetricsSnapshot metrics() {
        return metrics.snapshot();
    }
}
