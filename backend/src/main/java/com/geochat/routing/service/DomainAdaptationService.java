package com.geochat.routing.service;

import com.geochat.routing.model.DomainConfig;
import com.geochat.routing.model.DomainEnhancement;
import com.geochat.routing.model.EntityType;
import com.geochat.routing.model.RecognizedEntity;
import com.geochat.routing.text.QueryText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Normalises synonyms to canonical terms and measures how much of the query is domain
 * language. The enhanced query is internal; the user's original text is never changed.
 */
@Service
@Slf4j
public class DomainAdaptationService {

    private final EntityRecognizer entityRecognizer;

    public DomainAdaptationService(EntityRecognizer entityRecognizer) {
        this.entityRecognizer = entityRecognizer;
    }

    public DomainEnhancement enhance(QueryText text, List<RecognizedEntity> entities, DomainConfig config) {
        DomainEnhancement.DomainEnhancementBuilder builder = DomainEnhancement.builder();

        Set<String> applied = new LinkedHashSet<>();
        builder.enhancedQuery(canonicalize(text, config, applied));
        if (!applied.isEmpty()) {
            builder.trace("Synonyms normalised: " + String.join(", ", applied));
        }

        double relevance = relevance(text, entities, config);
        builder.domainRelevance(relevance);
        builder.trace(String.format("Domain relevance %.2f", relevance));

        List<RecognizedEntity> distinct = entityRecognizer.distinct(entities);
        builder.entityContext(distinct);
        String brands = names(distinct, EntityType.BRAND);
        if (!brands.isEmpty()) {
            builder.trace("Brands: " + brands);
        }
        String places = names(distinct, EntityType.PLACE);
        if (!places.isEmpty()) {
            builder.trace("Places: " + places);
        }
        String between = betweenSpan(text, distinct);
        if (between != null) {
            builder.trace("Geographic context: '" + between + "'");
        }
        return builder.build();
    }

    /**
     * Replaces synonym variants, longest match first, with their canonical terms.
     */
    String canonicalize(QueryText text, DomainConfig config, Set<String> applied) {
        List<String> out = new ArrayList<>();
        int i = 0;
        while (i < text.size()) {
            DomainConfig.SynonymRule rule = ruleAt(text, i, config);
            if (rule == null) {
                out.add(text.token(i));
                i++;
            } else {
                out.addAll(rule.getCanonicalTokens());
                applied.add(String.join(" ", rule.getVariant()) + " -> " + rule.getCanonical());
                i += rule.getVariant().size();
            }
        }
        return String.join(" ", out);
    }

    /**
     * Share of tokens that are vocabulary, part of an entity, or stopwords.
     */
    double relevance(QueryText text, List<RecognizedEntity> entities, DomainConfig config) {
        if (text.isEmpty()) {
            return 0.0;
        }
        int known = 0;
        for (QueryText.Token token : text.getTokens()) {
            if (config.isVocabulary(token.getText()) || config.isStopword(token.getText())
                    || insideEntity(token, entities)) {
                known++;
            }
        }
        return (double) known / text.size();
    }

    private static DomainConfig.SynonymRule ruleAt(QueryText text, int index, DomainConfig config) {
        // rules are sorted longest variant first
        for (DomainConfig.SynonymRule rule : config.getSynonymRules()) {
            if (text.matchesAt(rule.getVariant(), index)) {
                return rule;
            }
        }
        return null;
    }

    /**
     * "between A and B" where A and B are places: the original text of that span.
     */
    private static String betweenSpan(QueryText text, List<RecognizedEntity> entities) {
        for (int i = 0; i < text.size(); i++) {
            if (!"between".equals(text.token(i))) {
                continue;
            }
            int from = text.getTokens().get(i).getStart();
            List<RecognizedEntity> after = entities.stream()
                    .filter(e -> e.getType() == EntityType.PLACE && e.getStart() > from)
                    .collect(Collectors.toList());
            if (after.size() >= 2) {
                return text.getRaw().substring(from, after.get(1).getEnd());
            }
        }
        return null;
    }

    private static String names(List<RecognizedEntity> entities, EntityType type) {
        return entities.stream()
                .filter(e -> e.getType() == type)
                .map(e -> e.getCode() == null ? e.getSurface() : e.getSurface() + " (" + e.getCode() + ")")
                .collect(Collectors.joining(", "));
    }

    private static boolean insideEntity(QueryText.Token token, List<RecognizedEntity> entities) {
        for (RecognizedEntity entity : entities) {
            if (token.getStart() >= entity.getStart() && token.getEnd() <= entity.getEnd()) {
                return true;
            }
        }
        return false;
    }
}
