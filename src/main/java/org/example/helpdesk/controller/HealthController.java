package org.example.helpdesk.controller;

import lombok.RequiredArgsConstructor;
import org.example.helpdesk.dto.HealthResponse;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Liveness endpoints. They never touch the ticket store.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private static final long MEGABYTE = 1024L * 1024L;

    private final Clock clock;

    @GetMapping("/")
    public Map<String, Object> root() {
        return Map.of(
                "message", "Helpdesk API is running",
                "status", "healthy",
                "timestamp", Instant.now(clock));
    }

    @GetMapping("/api/health")
    public HealthResponse health() {
        Runtime runtime = Runtime.getRuntime();
        long usedHeap = runtime.totalMemory() - runtime.freeMemory();
        double uptimeSeconds = ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0;
        return new HealthResponse("OK", Instant.now(clock), uptimeSeconds,
                Math.round((double) usedHeap / MEGABYTE) + "MB");
    }

    /**
     * Plain text probe for container health checks.
     */
    @GetMapping(value = "/health", produces = MediaType.TEXT_PLAIN_VALUE)
    public String plainHealth() {
        return "OK";
    }
}
