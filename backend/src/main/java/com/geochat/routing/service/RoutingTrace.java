package com.geochat.routing.service;

import com.geochat.routing.model.RoutingLayer;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-query record of executed layers and their reasoning. Each step returns a new
 * instance; earlier snapshots stay unchanged.
 */
@Value
public class RoutingTrace {

    List<RoutingLayer> layers;
    List<String> reasoning;
    String earlyExit;

    public static RoutingTrace empty() {
        return new RoutingTrace(Collections.emptyList(), Collections.emptyList(), null);
    }

    public RoutingTrace append(RoutingLayer layer, List<String> lines) {
        List<RoutingLayer> nextLayers = new ArrayList<>(layers);
        nextLayers.add(layer);
        List<String> nextReasoning = new ArrayList<>(reasoning);
        for (String line : lines) {
            nextReasoning.add(layer.getLayerName() + ": " + line);
        }
        return new RoutingTrace(List.copyOf(nextLayers), List.copyOf(nextReasoning), earlyExit);
    }

    /**
     * Reasoning from a layer that did not run to completion.
     */
    public RoutingTrace note(RoutingLayer layer, String line) {
        List<String> nextReasoning = new ArrayList<>(reasoning);
        nextReasoning.add(layer.getLayerName() + ": " + line);
        return new RoutingTrace(layers, List.copyOf(nextReasoning), earlyExit);
    }

    /**
     * Records why the pipeline stopped early or degraded; the first reason is kept.
     */
    public RoutingTrace exit(String reason) {
        return earlyExit != null ? this : new RoutingTrace(layers, reasoning, reason);
    }
}
