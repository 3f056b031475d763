package com.phillippitts.voicegate.presentation.controller;

import com.phillippitts.voicegate.domain.DailyStats;
import com.phillippitts.voicegate.domain.ProviderHealthSnapshot;
import com.phillippitts.voicegate.service.health.ProviderHealthMonitor;
import com.phillippitts.voicegate.service.orchestration.VoiceOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only provider status for operational tooling. Speech requests do not go through HTTP.
 */
@RestController
@RequestMapping("/providers")
class ProviderStatusController {

    private static final Logger LOG = LogManager.getLogger(ProviderStatusController.class);

    private final ProviderHealthMonitor healthMonitor;
    private final VoiceOrchestrator orchestrator;
    private final Clock clock;

    ProviderStatusController(ProviderHealthMonitor healthMonitor, VoiceOrchestrator orchestrator, Clock clock) {
        this.healthMonitor = healthMonitor;
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, ProviderHealthSnapshot>> health(@RequestParam(required = false) String name) {
        LOG.debug("Health requested for {}", name == null ? "all providers" : name);
        return ResponseEntity.ok(healthMonitor.healthCheck(Optional.ofNullable(name)));
    }

    /**
     * Aggregated samples for one UTC day; defaults to today.
     */
    @GetMapping("/stats")
    ResponseEntity<DailyStats> stats(@RequestParam(required = false) String provider,
                                     @RequestParam(required = false)
                                     @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day) {
        LocalDate target = day != null ? day : LocalDate.now(clock);
        return ResponseEntity.ok(orchestrator.getDailyStats(Optional.ofNullable(provider), target));
    }
}
