package com.geochat.routing.service;

import com.geochat.routing.controller.MonitoringController;
import com.geochat.routing.model.RoutingResult;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory routing analytics over the most recent decisions.
 */
@Service
public class RoutingMetricsService {

    static final int MAX_RETAINED = 1000;

    private final Deque<RouteMetric> recent = new ConcurrentLinkedDeque<>();
    // ConcurrentLinkedDeque.size() walks the whole deque
    private final AtomicInteger retained = new AtomicInteger(0);
    private final AtomicLong totalQueries = new AtomicLong(0);
    private final AtomicLong routedQueries = new AtomicLong(0);

    public void recordRoute(RoutingResult result, long latencyMs) {
        String outcome = result.getUserResponse() == null ? "unknown"
                : result.getUserResponse().getType().getValue();
        recent.addLast(new RouteMetric(result.getEndpoint(), outcome, result.getEarlyExit(),
                latencyMs, result.isSuccess(), LocalDateTime.now()));
        retained.incrementAndGet();
        totalQueries.incrementAndGet();
        if (result.isSuccess()) {
            routedQueries.incrementAndGet();
        }
        while (retained.get() > MAX_RETAINED) {
            if (recent.pollFirst() == null) {
                break;
            }
            retained.decrementAndGet();
        }
    }

    public MonitoringController.RoutingAnalytics getRoutingAnalytics(int lookbackHours) {
        LocalDateTime cutoff = LocalDateTime.now().minusHours(lookbackHours);
        List<RouteMetric> window = recent.stream()
                .filter(m -> m.timestamp.isAfter(cutoff))
                .collect(Collectors.toList());

        MonitoringController.RoutingAnalytics analytics = new MonitoringController.RoutingAnalytics();
        analytics.setTotalQueries(window.size());
        if (window.isEmpty()) {
            analytics.setQueriesByEndpoint(Collections.emptyMap());
            analytics.setQueriesByOutcome(Collections.emptyMap());
            analytics.setEarlyExits(Collections.emptyMap());
            return analytics;
        }

        List<Long> latencies = window.stream()
                .map(m -> m.latencyMs)
                .sorted()
                .collect(Collectors.toList());
        analytics.setAverageLatencyMs(latencies.stream().mapToLong(Long::longValue).average().orElse(0.0));
        analytics.setP50LatencyMs(percentile(latencies, 0.50));
        analytics.setP95LatencyMs(percentile(latencies, 0.95));
        analytics.setP99LatencyMs(percentile(latencies, 0.99));

        Map<String, Long> byEndpoint = new HashMap<>();
        Map<String, Long> byOutcome = new HashMap<>();
        Map<String, Long> exits = new HashMap<>();
        for (RouteMetric metric : window) {
            if (metric.endpoint != null) {
                byEndpoint.merge(metric.endpoint, 1L, Long::sum);
            }
            byOutcome.merge(metric.outcome, 1L, Long::sum);
            if (metric.earlyExit != null) {
                exits.merge(metric.earlyExit, 1L, Long::sum);
            }
        }
        analytics.setQueriesByEndpoint(byEndpoint);
        analytics.setQueriesByOutcome(byOutcome);
        analytics.setEarlyExits(exits);

        long routed = window.stream().filter(m -> m.success).count();
        analytics.setRoutedQueries(routed);
        analytics.setRoutedRate((double) routed / window.size());
        return analytics;
    }

    public long getTotalQueries() {
        return totalQueries.get();
    }

    public long getRoutedQueries() {
        return routedQueries.get();
    }

    int getRetainedCount() {
        return retained.get();
    }

    private static double percentile(List<Long> values, double percentile) {
        int index = (int) Math.ceil(percentile * values.size()) - 1;
        index = Math.max(0, Math.min(index, values.size() - 1));
        return values.get(index);
    }

    private static final class RouteMetric {
        private final String endpoint;
        private final String outcome;
        private final String earlyExit;
        private final long latencyMs;
        private final boolean success;
        private final LocalDateTime timestamp;

        private RouteMetric(String endpoint, String outcome, String earlyExit, long latencyMs,
                            boolean success, LocalDateTime timestamp) {
            this.endpoint = endpoint;
            this.outcome = outcome;
            this.earlyExit = earlyExit;
            this.latencyMs = latencyMs;
            this.success = success;
            this.timestamp = timestamp;
        }
    }
}
