package com.phillippitts.tapguard.presentation.controller;

import com.phillippitts.tapguard.domain.RecoveryState;
import com.phillippitts.tapguard.service.recovery.CycleReport;
import com.phillippitts.tapguard.service.recovery.RecoveryCycleRunner;
import com.phillippitts.tapguard.service.recovery.RecoveryStatusBoard;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Read-only recovery status plus an on-demand cycle trigger for field technicians.
 */
@RestController
@RequestMapping("/api/v1/recovery")
class RecoveryStatusController {

    private final RecoveryStatusBoard board;
    private final RecoveryCycleRunner runner;

    RecoveryStatusController(RecoveryStatusBoard board, RecoveryCycleRunner runner) {
        this.board = board;
        this.runner = runner;
    }

    @GetMapping("/status")
    ResponseEntity<StatusResponse> status() {
        RecoveryStatusBoard.View view = board.view();
        return ResponseEntity.ok(new StatusResponse(view.state(), view.lastReport(), runner.isRunning()));
    }

    /**
     * Requests a cycle outside the polling schedule. Accepted, not awaited; a cycle already
     * running makes the request a no-op.
     */
    @PostMapping("/cycle")
    ResponseEntity<Map<String, String>> triggerCycle() {
        runner.requestCycle(RecoveryCycleRunner.TRIGGER_MANUAL);
        return ResponseEntity.accepted().body(Map.of("status", "requested"));
    }

    record StatusResponse(RecoveryState state, CycleReport lastCycle, boolean cycleRunning) {
    }
}
