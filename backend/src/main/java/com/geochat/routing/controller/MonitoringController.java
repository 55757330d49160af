package com.geochat.routing.controller;

import com.geochat.routing.client.SimilarityScorer;
import com.geochat.routing.config.DomainConfigLoader;
import com.geochat.routing.service.RoutingMetricsService;
import lombok.Data;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routing analytics and component health.
 */
@RestController
@RequestMapping("/monitoring")
@CrossOrigin(origins = "*")
public class MonitoringController {

    private final RoutingMetricsService metricsService;
    private final DomainConfigLoader configLoader;
    private final SimilarityScorer similarityScorer;

    public MonitoringController(RoutingMetricsService metricsService,
                                DomainConfigLoader configLoader,
                                SimilarityScorer similarityScorer) {
        this.metricsService = metricsService;
        this.configLoader = configLoader;
        this.similarityScorer = similarityScorer;
    }

    /**
     * Outcome counts, early exits and latency percentiles over the last {@code hours}.
     */
    @GetMapping("/routing")
    public ResponseEntity<RoutingAnalytics> routingAnalytics(@RequestParam(required = false) Integer hours) {
        int lookbackHours = hours != null ? hours : 24;
        return ResponseEntity.ok(metricsService.getRoutingAnalytics(lookbackHours));
    }

    @GetMapping("/health/summary")
    public ResponseEntity<HealthSummary> health() {
        HealthSummary summary = new HealthSummary();
        Map<String, String> components = new LinkedHashMap<>();
        components.put("domain_config", configLoader.isLoaded() ? "UP" : "DOWN");
        components.put("similarity", similarityScorer.isConfigured() ? "CONFIGURED" : "DISABLED");
        summary.setComponentStatus(components);
        summary.setOverallStatus(configLoader.isLoaded() ? "UP" : "DOWN");
        summary.setTotalQueries(metricsService.getTotalQueries());
        summary.setRoutedQueries(metricsService.getRoutedQueries());
        return ResponseEntity.ok(summary);
    }

    @Data
    public static class RoutingAnalytics {
        private long totalQueries;
        private long routedQueries;
        private double routedRate;
        private double averageLatencyMs;
        private double p50LatencyMs;
        private double p95LatencyMs;
        private double p99LatencyMs;
        private Map<String, Long> queriesByEndpoint;
        private Map<String, Long> queriesByOutcome;
        private Map<String, Long> earlyExits;
    }

    @Data
    public static class HealthSummary {
        private String overallStatus;
        private Map<String, String> componentStatus;
        private long totalQueries;
        private long routedQueries;
    }
}
