package com.researchplatform.webresearch.controller;

import com.researchplatform.webresearch.dto.ActionResult;
import com.researchplatform.webresearch.dto.UsageReport;
import com.researchplatform.webresearch.service.ResearchUsageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/research")
public class ResearchUsageController {

    private static final Logger log = LoggerFactory.getLogger(ResearchUsageController.class);

    private final ResearchUsageService usageService;

    public ResearchUsageController(ResearchUsageService usageService) {
        this.usageService = usageService;
    }

    @GetMapping("/usage")
    public Mono<ResponseEntity<UsageReport>> usage() {
        return Mono.fromSupplier(usageService::buildReport)
            .map(ResponseEntity::ok)
            .onErrorResume(e -> {
                log.error("[Usage] Failed to build usage report: {}", e.getMessage(), e);
                return Mono.just(ResponseEntity.internalServerError().build());
            });
    }

    @GetMapping(value = "/usage/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<String> report() {
        return Mono.fromSupplier(usageService::textReport);
    }

    @PostMapping("/usage/reset")
    public Mono<ResponseEntity<ActionResult>> resetUsage() {
        return Mono.fromRunnable(usageService::resetMetrics)
            .thenReturn(ResponseEntity.ok(ActionResult.ok("Metrics reset successfully")));
    }

    @PostMapping("/circuit-breakers/reset")
    public Mono<ResponseEntity<ActionResult>> resetCircuitBreakers() {
        return Mono.fromRunnable(usageService::resetCircuitBreakers)
            .thenReturn(ResponseEntity.ok(ActionResult.ok("Circuit breakers reset")));
    }
}
