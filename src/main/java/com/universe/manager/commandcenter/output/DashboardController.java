package com.universe.manager.commandcenter.output;

import com.universe.manager.commandcenter.polling.RefreshCoordinator;
import com.universe.manager.commandcenter.polling.RefreshRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST endpoints backing the executive command center view.
 */
@RestController
@RequestMapping("/command-center")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardStateSink dashboardStateSink;
    private final RefreshCoordinator refreshCoordinator;

    @GetMapping("/status")
    public CommandCenterStatus status() {
        return new CommandCenterStatus(
                dashboardStateSink.current(),
                refreshCoordinator.state(),
                refreshCoordinator.isRunning()
        );
    }

    /**
     * 202 when the refresh was started or folded into a pending one, 409 when polling is stopped.
     */
    @PostMapping("/refresh")
    public ResponseEntity<Map<String, RefreshRequest>> refresh() {
        RefreshRequest result = refreshCoordinator.manualRefresh();
        HttpStatus status = result.accepted() ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(Map.of("result", result));
    }
}
