package com.phillippitts.tapguard.presentation.controller;

import com.phillippitts.tapguard.service.terminal.TerminalSignalRegistry;
import com.phillippitts.tapguard.service.terminal.TerminalSignalUpdate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives signal updates from the terminal transport bridge.
 */
@RestController
@RequestMapping("/api/v1/terminal")
class TerminalSignalController {

    private static final Logger LOG = LogManager.getLogger(TerminalSignalController.class);

    private final TerminalSignalRegistry registry;

    TerminalSignalController(TerminalSignalRegistry registry) {
        this.registry = registry;
    }

    @PostMapping("/signals")
    ResponseEntity<Void> push(@RequestBody TerminalSignalUpdate update) {
        LOG.debug("Signal push received");
        registry.apply(update);
        return ResponseEntity.noContent().build();
    }
}
