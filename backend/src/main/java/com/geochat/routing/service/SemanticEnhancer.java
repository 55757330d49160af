package com.geochat.routing.service;

import com.geochat.routing.client.SimilarityScorer;
import com.geochat.routing.config.RoutingProperties;
import com.geochat.routing.model.EndpointCandidate;
import com.geochat.routing.model.SemanticEnhancement;
import com.geochat.routing.text.QueryText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Optional re-ranking of keyword candidates by an external similarity score. Any
 * failure, timeout or missing backend yields {@link SemanticEnhancement#unavailable}
 * and routing continues on keyword scores alone. When the gate is enabled the backend
 * is only asked about low-confidence, unusually phrased or compound queries.
 */
@Service
@Slf4j
public class SemanticEnhancer {

    static final String NOT_CONFIGURED = "not_configured";
    static final String BACKEND_ERROR = "backend_error";
    static final String NO_SCORES = "no_scores";
    static final String NOT_NEEDED = "not_needed";

    private final RoutingProperties properties;
    private final SimilarityScorer scorer;

    public SemanticEnhancer(RoutingProperties properties, SimilarityScorer scorer) {
        this.properties = properties;
        this.scorer = scorer;
    }

    public SemanticEnhancement enhance(String query, List<EndpointCandidate> candidates) {
        if (candidates.isEmpty() || scorer == null || !scorer.isConfigured()) {
            return SemanticEnhancement.unavailable(NOT_CONFIGURED);
        }
        EndpointCandidate keywordLeader = candidates.get(0);
        if (!worthAsking(query, keywordLeader)) {
            return SemanticEnhancement.skipped(NOT_NEEDED, String.format(
                    "Skipped: keyword leader %s at %.2f needs no similarity check",
                    keywordLeader.getEndpointId(), keywordLeader.getNormalizedScore()));
        }

        Map<String, Double> similarity;
        try {
            similarity = scorer.score(query, candidates.stream()
                    .map(EndpointCandidate::getEndpointId)
                    .collect(Collectors.toList()));
        } catch (RuntimeException e) {
            log.warn("⚠️ Similarity backend failed, falling back to keyword scores: {}", e.getMessage());
            return SemanticEnhancement.unavailable(BACKEND_ERROR);
        }
        if (similarity == null || similarity.isEmpty()) {
            return SemanticEnhancement.unavailable(NO_SCORES);
        }

        double keywordWeight = properties.getSemantic().getKeywordWeight();
        List<Scored> scored = new ArrayList<>();
        for (EndpointCandidate candidate : candidates) {
            Double s = similarity.get(candidate.getEndpointId());
            // unscored candidates blend with zero similarity so every score shares one scale
            double similarityScore = s == null || s.isNaN() ? 0.0 : clamp(s);
            double blended = keywordWeight * candidate.getNormalizedScore() + (1 - keywordWeight) * similarityScore;
            scored.add(new Scored(candidate, blended));
        }
        // stable: a candidate only overtakes when its blended score is strictly higher
        scored.sort(Comparator.comparingDouble((Scored s) -> s.blended).reversed());

        Scored leader = scored.get(0);
        String trace = String.format("Semantic blend %.0f%% keyword / %.0f%% similarity: %s leads at %.2f",
                keywordWeight * 100, (1 - keywordWeight) * 100, leader.candidate.getEndpointId(), leader.blended);
        if (!leader.candidate.getEndpointId().equals(keywordLeader.getEndpointId())) {
            trace += " (promoted over " + keywordLeader.getEndpointId() + ")";
        }
        return SemanticEnhancement.available(
                scored.stream().map(s -> s.candidate).collect(Collectors.toList()),
                scored.stream().map(s -> s.blended).collect(Collectors.toList()),
                trace);
    }

    /**
     * Low keyword confidence, novel phrasing or a compound question; always true with the gate off.
     */
    boolean worthAsking(String query, EndpointCandidate keywordLeader) {
        RoutingProperties.Gate gate = properties.getSemantic().getGate();
        if (!gate.isEnabled() || keywordLeader.getNormalizedScore() < gate.getConfidenceBelow()) {
            return true;
        }
        QueryText text = QueryText.of(query);
        return containsAny(text, gate.getNovelPhrases()) || containsAny(text, gate.getCompoundPhrases());
    }

    private static boolean containsAny(QueryText text, List<String> phrases) {
        for (String phrase : phrases) {
            List<String> tokens = QueryText.tokenize(phrase);
            if (!tokens.isEmpty() && text.containsPhrase(tokens)) {
                return true;
            }
        }
        return false;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static final class Scored {
        private final EndpointCandidate candidate;
        private final double blended;

        private Scored(EndpointCandidate candidate, double blended) {
            this.candidate = candidate;
            this.blended = blended;
        }
    }
}
