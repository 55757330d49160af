package com.geochat.routing.service;

import com.geochat.routing.config.RoutingProperties;
import com.geochat.routing.model.DomainConfig;
import com.geochat.routing.model.EntityType;
import com.geochat.routing.model.QueryScope;
import com.geochat.routing.model.RecognizedEntity;
import com.geochat.routing.model.RejectionCategory;
import com.geochat.routing.model.RoutingQuery;
import com.geochat.routing.model.ValidationResult;
import com.geochat.routing.text.QueryText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * First-pass admissibility check. Hard-reject heuristics run on the raw query text and
 * force {@code out_of_scope} with confidence 1.0; otherwise scope is decided by the
 * ratio of content tokens that belong to the domain vocabulary.
 */
@Service
@Slf4j
public class ScopeValidator {

    static final String NO_ALPHABETIC_TOKENS = "no_alphabetic_tokens";
    static final String BELOW_MIN_TOKENS = "below_min_token_count";
    static final String OFF_TOPIC = "off_topic";
    static final String NO_RECOGNIZABLE_TOKENS = "no_recognizable_tokens";
    static final String OVERLAP_ABOVE_FLOOR = "overlap_above_floor";
    static final String OVERLAP_BELOW_FLOOR = "overlap_below_floor";
    static final String CONVERSATION_CONTEXT = "in_scope_with_conversation_context";

    private static final List<String> GENERIC_SUGGESTIONS = List.of(
            "Try: \"Analyze market insights for [your specific business area]\"",
            "Include terms like \"demographics\", \"competition\", or \"market share\"",
            "Specify a geographic area or customer segment for analysis");

    private final RoutingProperties properties;
    private final EntityRecognizer entityRecognizer;

    public ScopeValidator(RoutingProperties properties, EntityRecognizer entityRecognizer) {
        this.properties = properties;
        this.entityRecognizer = entityRecognizer;
    }

    public ValidationResult validate(RoutingQuery query, DomainConfig config) {
        RoutingProperties.Scope scope = properties.getScope();
        QueryText text = QueryText.of(query.getText());

        if (text.getTokens().stream().noneMatch(t -> t.getText().chars().anyMatch(Character::isLetter))) {
            return hardReject(NO_ALPHABETIC_TOKENS + ": query contains no alphabetic tokens", null, config, text, List.of());
        }
        if (text.size() < scope.getMinTokenCount()) {
            return hardReject(BELOW_MIN_TOKENS + ": " + text.size() + " token(s), minimum is "
                    + scope.getMinTokenCount(), null, config, text, List.of());
        }

        List<RecognizedEntity> entities = entityRecognizer.recognize(text, config);
        RejectionCategory offTopic = matchOffTopic(text, config, scope.getRejectionThreshold());
        if (offTopic != null) {
            return hardReject(OFF_TOPIC + ": query matches '" + offTopic.getName() + "' patterns",
                    offTopic.getRedirectMessage(), config, text, entities);
        }

        if (countRecognized(text, entities, config) == 0) {
            return hardReject(NO_RECOGNIZABLE_TOKENS + ": none of " + text.size()
                    + " tokens is domain vocabulary, an entity or a stopword", null, config, text, entities);
        }

        double overlap = overlapRatio(text, entities, config);
        if (overlap > scope.getOverlapFloor()) {
            return ValidationResult.builder()
                    .scope(QueryScope.IN_SCOPE)
                    .confidence(clamp(overlap))
                    .reason(String.format("%s: vocabulary overlap %.2f > %.2f",
                            OVERLAP_ABOVE_FLOOR, overlap, scope.getOverlapFloor()))
                    .build();
        }

        if (query.getConversationContext() != null && !query.getConversationContext().isBlank()) {
            QueryText withContext = text.with(query.getConversationContext());
            double contextual = overlapRatio(withContext, entityRecognizer.recognize(withContext, config), config);
            if (contextual > scope.getOverlapFloor()) {
                log.debug("Query overlap {} below floor, rescued by conversation context ({})", overlap, contextual);
                return ValidationResult.builder()
                        .scope(QueryScope.IN_SCOPE)
                        .confidence(clamp(contextual))
                        .reason(String.format("%s: query overlap %.2f, with context %.2f > %.2f",
                                CONVERSATION_CONTEXT, overlap, contextual, scope.getOverlapFloor()))
                        .build();
            }
        }

        return ValidationResult.builder()
                .scope(QueryScope.OUT_OF_SCOPE)
                .confidence(clamp(overlap))
                .reason(String.format("%s: vocabulary overlap %.2f <= %.2f",
                        OVERLAP_BELOW_FLOOR, overlap, scope.getOverlapFloor()))
                .suggestions(suggest(text, entities, config))
                .build();
    }

    /**
     * Share of non-stopword tokens that are domain vocabulary or part of a recognised entity.
     */
    double overlapRatio(QueryText text, List<RecognizedEntity> entities, DomainConfig config) {
        int content = 0;
        int matched = 0;
        for (QueryText.Token token : text.getTokens()) {
            if (config.isStopword(token.getText())) {
                continue;
            }
            content++;
            if (config.isVocabulary(token.getText()) || insideEntity(token, entities)) {
                matched++;
            }
        }
        return content == 0 ? 0.0 : (double) matched / content;
    }

    private int countRecognized(QueryText text, List<RecognizedEntity> entities, DomainConfig config) {
        int recognized = 0;
        for (QueryText.Token token : text.getTokens()) {
            if (config.isStopword(token.getText()) || config.isVocabulary(token.getText())
                    || insideEntity(token, entities)) {
                recognized++;
            }
        }
        return recognized;
    }

    private RejectionCategory matchOffTopic(QueryText text, DomainConfig config, double threshold) {
        double score = 0.0;
        RejectionCategory strongest = null;
        for (RejectionCategory category : config.getRejectionCategories()) {
            for (List<String> pattern : category.getPatterns()) {
                if (text.containsPhrase(pattern)) {
                    score += category.getWeight();
                    if (strongest == null || category.getWeight() > strongest.getWeight()) {
                        strongest = category;
                    }
                }
            }
        }
        return score >= threshold ? strongest : null;
    }

    private ValidationResult hardReject(String reason, String redirect, DomainConfig config,
                                        QueryText text, List<RecognizedEntity> entities) {
        log.debug("Scope hard reject: {}", reason);
        return ValidationResult.builder()
                .scope(QueryScope.OUT_OF_SCOPE)
                .confidence(1.0)
                .reason(reason)
                .redirectMessage(redirect)
                .suggestions(suggest(text, entities, config))
                .build();
    }

    private List<String> suggest(QueryText text, List<RecognizedEntity> entities, DomainConfig config) {
        Set<String> suggestions = new LinkedHashSet<>();
        List<RecognizedEntity> distinct = entityRecognizer.distinct(entities);
        List<String> places = new ArrayList<>();
        for (RecognizedEntity entity : distinct) {
            if (entity.getType() == EntityType.PLACE) {
                places.add(entity.getSurface());
            }
        }
        if (!places.isEmpty()) {
            suggestions.add("Try: \"Analyze the " + places.get(0) + " market for business opportunities\"");
        }
        boolean relational = config.getRelationalPhrases().stream().anyMatch(text::containsPhrase);
        if (relational && distinct.size() >= 2) {
            suggestions.add("Try: \"Compare performance between " + distinct.get(0).getSurface()
                    + " and " + distinct.get(1).getSurface() + "\"");
        }
        suggestions.addAll(GENERIC_SUGGESTIONS);
        return new ArrayList<>(suggestions).subList(0, Math.min(suggestions.size(),
                properties.getScope().getMaxSuggestions()));
    }

    private static boolean insideEntity(QueryText.Token token, List<RecognizedEntity> entities) {
        for (RecognizedEntity entity : entities) {
            if (token.getStart() >= entity.getStart() && token.getEnd() <= entity.getEnd()) {
                return true;
            }
        }
        return false;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
