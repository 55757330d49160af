package com.geochat.routing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for the routing pipeline, bound from {@code routing.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "routing")
public class RoutingProperties {

    /**
     * Spring resource location of the domain configuration document.
     */
    private String configLocation = "classpath:domain-config.json";

    /**
     * Spring resource location of the live field inventory.
     */
    private String fieldInventoryLocation = "classpath:field-inventory.json";

    private Scope scope = new Scope();
    private Intent intent = new Intent();
    private Context context = new Context();
    private Semantic semantic = new Semantic();
    private Decision decision = new Decision();

    @Data
    public static class Scope {
        /**
         * Queries with fewer tokens are rejected outright.
         */
        private int minTokenCount = 2;

        /**
         * Vocabulary overlap ratio a query must exceed to be in scope.
         */
        private double overlapFloor = 0.2;

        /**
         * Summed off-topic category weight that forces a reject.
         */
        private double rejectionThreshold = 0.8;

        private int maxSuggestions = 4;
    }

    @Data
    public static class Intent {
        private double phraseMultiplier = 1.5;
        private double entityBonus = 0.5;
        private double relationalBonus = 0.4;

        /**
         * Fraction of a foreign term's weight subtracted when it appears in the query.
         */
        private double crossEndpointPenalty = 0.25;

        /**
         * Number of strongest signature terms that make up an endpoint's attainable maximum.
         */
        private int saturationTermCount = 3;

        /**
         * Subtracted once per matched entry of an endpoint's own {@code penalty_terms}.
         */
        private double penaltyTermWeight = 0.5;
    }

    @Data
    public static class Context {
        private int maxCandidates = 4;
        private double fieldMentionBoost = 0.05;
        private double maxContextualBoost = 0.15;

        /**
         * When true an endpoint with any missing required field cannot be routed to.
         */
        private boolean requireFullCoverage = false;
    }

    @Data
    public static class Semantic {
        private boolean enabled = false;
        private String url;
        private long timeoutMs = 300;

        /**
         * Share of the keyword score in the blended score; the rest is similarity.
         */
        private double keywordWeight = 0.7;

        private Gate gate = new Gate();
    }

    /**
     * Limits similarity calls to queries keyword scoring is likely to get wrong. With the
     * gate disabled every query with candidates is sent to the backend.
     */
    @Data
    public static class Gate {
        private boolean enabled = true;

        /**
         * Keyword leader's normalised score below which the backend is consulted.
         */
        private double confidenceBelow = 0.6;

        private List<String> novelPhrases = new ArrayList<>(List.of(
                "what would happen if", "help me understand", "can you break down", "show me which",
                "tell me about", "i want to understand", "help me identify"));

        private List<String> compoundPhrases = new ArrayList<>(List.of(
                "and also", "but also", "combined with", "along with", "as well as", "plus", "additionally"));
    }

    @Data
    public static class Decision {
        /**
         * Distance below an endpoint's threshold inside which we ask for clarification.
         */
        private double nearMissBand = 0.15;
        private int maxAlternatives = 3;
    }
}
