package com.geochat.routing.service;

import com.geochat.routing.config.RoutingProperties;
import com.geochat.routing.model.Alternative;
import com.geochat.routing.model.ContextEnhancement;
import com.geochat.routing.model.DomainConfig;
import com.geochat.routing.model.DomainEnhancement;
import com.geochat.routing.model.EndpointCandidate;
import com.geochat.routing.model.EndpointDescriptor;
import com.geochat.routing.model.ResponseType;
import com.geochat.routing.model.RoutingLayer;
import com.geochat.routing.model.RoutingResult;
import com.geochat.routing.model.SemanticEnhancement;
import com.geochat.routing.model.UserResponse;
import com.geochat.routing.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Combines the layer outputs into one confidence and decides between routing, asking
 * for clarification and rejecting.
 *
 * <pre>
 * final = clamp(intent x domainRelevance x (0.5 + 0.5 x coverage) + contextualBoost)
 * </pre>
 * where {@code intent} is the blended semantic score when available, else the
 * normalised keyword score.
 */
@Service
@Slf4j
public class ConfidenceAggregator {

    static final String OUT_OF_SCOPE_MESSAGE =
            "This question is outside the market analysis I can help with.";
    static final String NO_MATCH_MESSAGE =
            "I couldn't match your question to a specific analysis.";

    private final RoutingProperties properties;
    private final ContextEnhancementService contextService;

    public ConfidenceAggregator(RoutingProperties properties, ContextEnhancementService contextService) {
        this.properties = properties;
        this.contextService = contextService;
    }

    /**
     * Terminal result for a query the validator refused.
     */
    public RoutingResult reject(ValidationResult validation, RoutingTrace trace) {
        String message = validation.getRedirectMessage() != null
                ? validation.getRedirectMessage()
                : OUT_OF_SCOPE_MESSAGE;
        return RoutingResult.builder()
                .confidence(0.0)
                .success(false)
                .validation(validation)
                .layersExecuted(trace.getLayers())
                .earlyExit(trace.getEarlyExit())
                .reasoning(trace.getReasoning())
                .userResponse(UserResponse.builder()
                        .type(ResponseType.REJECTED)
                        .message(message)
                        .suggestions(validation.getSuggestions())
                        .build())
                .build();
    }

    /**
     * @param ranked   candidates in final order (semantic order when semantic is available)
     * @param contexts context results for the top candidates, keyed by endpoint id
     */
    public RoutingResult decide(ValidationResult validation, List<EndpointCandidate> ranked,
                                DomainEnhancement domain, SemanticEnhancement semantic,
                                Map<String, ContextEnhancement> contexts, DomainConfig config,
                                RoutingTrace trace) {
        RoutingResult.RoutingResultBuilder result = RoutingResult.builder()
                .validation(validation)
                .matchedEntities(domain.getEntityContext());

        if (ranked.isEmpty()) {
            RoutingTrace finished = trace.append(RoutingLayer.CONFIDENCE_MANAGEMENT,
                    List.of("No endpoint scored above zero"));
            return result
                    .confidence(0.0)
                    .success(false)
                    .layersExecuted(finished.getLayers())
                    .earlyExit(finished.getEarlyExit())
                    .reasoning(finished.getReasoning())
                    .userResponse(UserResponse.builder()
                            .type(ResponseType.REJECTED)
                            .message(NO_MATCH_MESSAGE)
                            .suggestions(suggestions(List.of(), config))
                            .build())
                    .build();
        }

        EndpointCandidate leader = ranked.get(0);
        EndpointDescriptor endpoint = config.findEndpoint(leader.getEndpointId())
                .orElseThrow(() -> new IllegalStateException("Unknown endpoint " + leader.getEndpointId()));
        double intent = intentScore(ranked, 0, semantic);
        ContextEnhancement context = contexts.get(leader.getEndpointId());
        double confidence = finalScore(intent, domain, context);
        boolean available = context == null || contextService.isAvailable(context);

        List<String> lines = new ArrayList<>();
        lines.add(String.format("%s: intent %.2f x relevance %.2f x coverage factor %.2f + boost %.2f = %.2f (threshold %.2f)",
                leader.getEndpointId(), intent, domain.getDomainRelevance(), coverageFactor(context),
                context == null ? 0.0 : context.getContextualBoost(), confidence, endpoint.getMinConfidence()));

        List<Alternative> alternatives = alternatives(ranked, semantic, domain, contexts, confidence);
        result.confidence(confidence).alternatives(alternatives);

        UserResponse.UserResponseBuilder response = UserResponse.builder();
        if (confidence >= endpoint.getMinConfidence() && available) {
            lines.add("Routed to " + endpoint.getId());
            result.endpoint(endpoint.getId()).success(true);
            response.type(ResponseType.ROUTED)
                    .message("Running " + endpoint.getDisplayName() + ".");
        } else if (!available) {
            lines.add(endpoint.getId() + " unavailable, missing fields " + context.getFieldRequirements().getMissing());
            result.success(false);
            response.type(ResponseType.CLARIFY)
                    .message("The data needed for " + endpoint.getDisplayName()
                            + " isn't available right now. Could you try a related analysis?")
                    .suggestions(suggestions(alternatives, config));
        } else if (confidence >= endpoint.getMinConfidence() - properties.getDecision().getNearMissBand()) {
            lines.add("Near miss, asking for clarification");
            result.success(false);
            List<String> suggestions = new ArrayList<>(endpoint.getExampleQueries());
            suggestions.addAll(suggestions(alternatives, config));
            response.type(ResponseType.CLARIFY)
                    .message("Did you mean " + endpoint.getDisplayName() + "?")
                    .suggestions(limit(new ArrayList<>(new LinkedHashSet<>(suggestions))));
        } else {
            lines.add("Below threshold, not routed");
            result.success(false);
            response.type(ResponseType.REJECTED)
                    .message(NO_MATCH_MESSAGE)
                    .suggestions(suggestions(alternatives, config));
        }

        RoutingTrace finished = trace.append(RoutingLayer.CONFIDENCE_MANAGEMENT, lines);
        log.debug("Leader {} at {} -> {}", leader.getEndpointId(), confidence, response.build().getType());
        return result
                .layersExecuted(finished.getLayers())
                .earlyExit(finished.getEarlyExit())
                .reasoning(finished.getReasoning())
                .userResponse(response.build())
                .build();
    }

    double finalScore(double intent, DomainEnhancement domain, ContextEnhancement context) {
        double boost = context == null ? 0.0 : context.getContextualBoost();
        return clamp(intent * domain.getDomainRelevance() * coverageFactor(context) + boost);
    }

    private static double coverageFactor(ContextEnhancement context) {
        // candidates outside the context window get the neutral midpoint
        return context == null ? 0.5 : 0.5 + 0.5 * context.getCoverageScore();
    }

    private static double intentScore(List<EndpointCandidate> ranked, int index, SemanticEnhancement semantic) {
        return semantic.isAvailable() ? semantic.blendedScore(index) : ranked.get(index).getNormalizedScore();
    }

    /**
     * Runners-up by final score, best first. A runner-up whose final score beats the
     * leader's confidence is left out so the list never contradicts the routing decision.
     */
    private List<Alternative> alternatives(List<EndpointCandidate> ranked, SemanticEnhancement semantic,
                                           DomainEnhancement domain, Map<String, ContextEnhancement> contexts,
                                           double confidence) {
        List<Alternative> scored = new ArrayList<>();
        for (int i = 1; i < ranked.size(); i++) {
            String id = ranked.get(i).getEndpointId();
            scored.add(new Alternative(id, finalScore(intentScore(ranked, i, semantic), domain, contexts.get(id))));
        }
        // stable: equal scores keep intent order
        scored.sort(Comparator.comparingDouble(Alternative::getScore).reversed());
        return scored.stream()
                .filter(alternative -> alternative.getScore() <= confidence)
                .limit(properties.getDecision().getMaxAlternatives())
                .collect(Collectors.toList());
    }

    /**
     * Example queries of the alternatives, then of the highest-priority endpoints.
     */
    private List<String> suggestions(List<Alternative> alternatives, DomainConfig config) {
        Set<String> suggestions = new LinkedHashSet<>();
        for (Alternative alternative : alternatives) {
            config.findEndpoint(alternative.getEndpointId())
                    .ifPresent(e -> suggestions.add(firstExample(e)));
        }
        config.getEndpoints().stream()
                .sorted(Comparator.comparingInt(EndpointDescriptor::getPriorityRank))
                .forEach(e -> suggestions.add(firstExample(e)));
        return limit(new ArrayList<>(suggestions));
    }

    private List<String> limit(List<String> suggestions) {
        int max = properties.getScope().getMaxSuggestions();
        return suggestions.size() <= max ? suggestions : suggestions.subList(0, max);
    }

    private static String firstExample(EndpointDescriptor endpoint) {
        return endpoint.getExampleQueries().isEmpty()
                ? "Ask about " + endpoint.getDisplayName().toLowerCase()
                : endpoint.getExampleQueries().get(0);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
