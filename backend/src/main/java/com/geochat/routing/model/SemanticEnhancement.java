package com.geochat.routing.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Either re-ranked candidates with blended scores, or an explicit "unavailable" marker.
 * The aggregator branches once on {@link #isAvailable()} regardless of whether a
 * similarity backend is configured.
 */
public final class SemanticEnhancement {

    private final List<EndpointCandidate> candidates;
    private final List<Double> blendedScores;
    private final String unavailableReason;
    private final String trace;
    private final boolean skipped;

    private SemanticEnhancement(List<EndpointCandidate> candidates, List<Double> blendedScores,
                                String unavailableReason, String trace, boolean skipped) {
        this.candidates = candidates;
        this.blendedScores = blendedScores;
        this.unavailableReason = unavailableReason;
        this.trace = trace;
        this.skipped = skipped;
    }

    /**
     * @param candidates    candidates in their new order
     * @param blendedScores blended normalized score per candidate, same order
     */
    public static SemanticEnhancement available(List<EndpointCandidate> candidates,
                                                List<Double> blendedScores, String trace) {
        if (candidates.size() != blendedScores.size()) {
            throw new IllegalArgumentException("Each candidate needs exactly one blended score");
        }
        return new SemanticEnhancement(List.copyOf(candidates), List.copyOf(blendedScores), null, trace, false);
    }

    public static SemanticEnhancement unavailable(String reason) {
        return new SemanticEnhancement(Collections.emptyList(), Collections.emptyList(),
                Objects.requireNonNull(reason), "Semantic enhancement unavailable; using keyword scores", false);
    }

    /**
     * The backend was reachable in principle but the query did not need it. Keyword scores
     * stand, and this is not a degradation.
     */
    public static SemanticEnhancement skipped(String reason, String trace) {
        return new SemanticEnhancement(Collections.emptyList(), Collections.emptyList(),
                Objects.requireNonNull(reason), trace, true);
    }

    public boolean isAvailable() {
        return unavailableReason == null;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public List<EndpointCandidate> getCandidates() {
        return candidates;
    }

    public double blendedScore(int index) {
        return blendedScores.get(index);
    }

    public String getUnavailableReason() {
        return unavailableReason;
    }

    public String getTrace() {
        return trace;
    }
}
