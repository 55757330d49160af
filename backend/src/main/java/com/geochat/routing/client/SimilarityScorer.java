package com.geochat.routing.client;

import java.util.List;
import java.util.Map;

/**
 * External semantic similarity backend. Implementations may throw on any failure;
 * callers treat a failure as "semantic enhancement unavailable".
 */
public interface SimilarityScorer {

    /**
     * Whether a backend is configured at all.
     */
    boolean isConfigured();

    /**
     * @return similarity in [0,1] keyed by candidate endpoint id; ids may be missing
     */
    Map<String, Double> score(String query, List<String> candidateIds);
}
