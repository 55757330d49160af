package com.geochat.routing.service;

import com.geochat.routing.config.RoutingProperties;
import com.geochat.routing.model.BoostTerm;
import com.geochat.routing.model.DomainConfig;
import com.geochat.routing.model.EndpointCandidate;
import com.geochat.routing.model.EndpointDescriptor;
import com.geochat.routing.model.RecognizedEntity;
import com.geochat.routing.model.RoutingQuery;
import com.geochat.routing.text.QueryText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores a query against every endpoint's intent signature with one generic loop over
 * configuration data. Produces a ranked candidate list of endpoints with a positive
 * score; thresholds are applied later by {@link ConfidenceAggregator}.
 */
@Service
@Slf4j
public class IntentClassifier {

    static final Comparator<EndpointCandidate> RANKING = Comparator
            .comparingDouble(EndpointCandidate::getRawScore).reversed()
            .thenComparing(Comparator.comparingInt(EndpointCandidate::getMatchedCategories).reversed())
            .thenComparingInt(EndpointCandidate::getPriorityRank)
            .thenComparing(EndpointCandidate::getEndpointId);

    private final RoutingProperties properties;
    private final EntityRecognizer entityRecognizer;

    public IntentClassifier(RoutingProperties properties, EntityRecognizer entityRecognizer) {
        this.properties = properties;
        this.entityRecognizer = entityRecognizer;
    }

    public List<EndpointCandidate> classify(RoutingQuery query, DomainConfig config) {
        QueryText text = QueryText.of(query.getText());
        return classify(text, entityRecognizer.recognize(text, config), config);
    }

    public List<EndpointCandidate> classify(QueryText text, List<RecognizedEntity> entities, DomainConfig config) {
        Map<String, BoostTerm> strongestTerms = strongestTerms(config);
        List<RecognizedEntity> distinctEntities = entityRecognizer.distinct(entities);

        List<EndpointCandidate> candidates = new ArrayList<>();
        for (EndpointDescriptor endpoint : config.getEndpoints()) {
            EndpointCandidate candidate = score(endpoint, text, distinctEntities, strongestTerms, config);
            if (candidate.getRawScore() > 0.0) {
                candidates.add(candidate);
            }
        }
        candidates.sort(RANKING);
        if (log.isDebugEnabled()) {
            candidates.forEach(c -> log.debug("   {}", c.getReasoning()));
        }
        return candidates;
    }

    EndpointCandidate score(EndpointDescriptor endpoint, QueryText text, List<RecognizedEntity> entities,
                            Map<String, BoostTerm> strongestTerms, DomainConfig config) {
        RoutingProperties.Intent intent = properties.getIntent();
        boolean[] covered = new boolean[text.size()];
        Set<String> ownTerms = new HashSet<>();
        Set<String> categories = new LinkedHashSet<>();
        List<String> matchedTerms = new ArrayList<>();
        double termScore = 0.0;

        for (BoostTerm term : endpoint.getBoostTerms()) {
            ownTerms.add(term.getTerm());
            double best = 0.0;
            for (List<String> form : term.getForms()) {
                List<Integer> starts = text.occurrences(form);
                if (starts.isEmpty()) {
                    continue;
                }
                cover(covered, starts, form.size());
                double value = form.size() > 1 ? term.getWeight() * intent.getPhraseMultiplier() : term.getWeight();
                best = Math.max(best, value);
            }
            if (best == 0.0 && term.isPhrase() && text.containsAll(term.getTokens())) {
                // scattered tokens: plain weight, no phrase bonus
                for (int i = 0; i < text.size(); i++) {
                    if (term.getTokens().contains(text.token(i))) {
                        covered[i] = true;
                    }
                }
                best = term.getWeight();
            }
            if (best > 0.0) {
                termScore += best;
                matchedTerms.add(term.getTerm());
                categories.add(term.getCategory());
            }
        }

        double entityScore = 0.0;
        List<String> matchedEntities = new ArrayList<>();
        double relationalScore = 0.0;
        if (!matchedTerms.isEmpty()) {
            for (RecognizedEntity entity : entities) {
                if (endpoint.getEntityTypes().contains(entity.getType())) {
                    entityScore += intent.getEntityBonus();
                    matchedEntities.add(entity.getCanonicalId());
                }
            }
            if (endpoint.isComparative()) {
                for (List<String> phrase : config.getRelationalPhrases()) {
                    if (text.containsPhrase(phrase)) {
                        relationalScore += intent.getRelationalBonus();
                    }
                }
            }
        }

        double penalty = 0.0;
        List<String> penalized = new ArrayList<>();
        for (BoostTerm foreign : strongestTerms.values()) {
            if (ownTerms.contains(foreign.getTerm())) {
                continue;
            }
            if (hasDisjointOccurrence(foreign, text, covered)) {
                penalty += intent.getCrossEndpointPenalty() * foreign.getWeight();
                penalized.add(foreign.getTerm());
            }
        }

        double avoidance = 0.0;
        List<String> avoided = new ArrayList<>();
        for (BoostTerm term : endpoint.getPenaltyTerms()) {
            if (term.getForms().stream().anyMatch(form -> !text.occurrences(form).isEmpty())) {
                avoidance += term.getWeight();
                avoided.add(term.getTerm());
            }
        }

        double raw = Math.max(0.0, termScore + entityScore + relationalScore - penalty - avoidance);
        String reasoning = String.format("%s: score %.2f/%.2f, terms %s, entities %s%s%s%s",
                endpoint.getId(), raw, maxScore(endpoint, config), matchedTerms, matchedEntities,
                relationalScore > 0 ? String.format(", relational +%.2f", relationalScore) : "",
                penalty > 0 ? String.format(", overlap penalty -%.2f %s", penalty, penalized) : "",
                avoidance > 0 ? String.format(", penalty terms -%.2f %s", avoidance, avoided) : "");

        return EndpointCandidate.builder()
                .endpointId(endpoint.getId())
                .rawScore(raw)
                .maxScore(maxScore(endpoint, config))
                .matchedTerms(matchedTerms)
                .matchedEntities(matchedEntities)
                .matchedCategories(categories.size())
                .priorityRank(endpoint.getPriorityRank())
                .reasoning(reasoning)
                .build();
    }

    /**
     * Attainable maximum: the strongest few signature terms at full phrase value, plus the
     * relational bonus for comparison endpoints. Entity bonuses are left out so a query
     * naming entities can saturate the normalised score.
     */
    double maxScore(EndpointDescriptor endpoint, DomainConfig config) {
        RoutingProperties.Intent intent = properties.getIntent();
        List<Double> values = new ArrayList<>();
        for (BoostTerm term : endpoint.getBoostTerms()) {
            values.add(term.isPhrase() ? term.getWeight() * intent.getPhraseMultiplier() : term.getWeight());
        }
        values.sort(Comparator.reverseOrder());
        double max = 0.0;
        for (int i = 0; i < Math.min(intent.getSaturationTermCount(), values.size()); i++) {
            max += values.get(i);
        }
        if (endpoint.isComparative() && !config.getRelationalPhrases().isEmpty()) {
            max += intent.getRelationalBonus();
        }
        return max;
    }

    /**
     * Every signature term across endpoints, keeping the heaviest weight per term text.
     */
    private Map<String, BoostTerm> strongestTerms(DomainConfig config) {
        Map<String, BoostTerm> strongest = new HashMap<>();
        for (EndpointDescriptor endpoint : config.getEndpoints()) {
            for (BoostTerm term : endpoint.getBoostTerms()) {
                strongest.merge(term.getTerm(), term,
                        (a, b) -> b.getWeight() > a.getWeight() ? b : a);
            }
        }
        return strongest;
    }

    /**
     * True when the term occurs somewhere that shares no token with the endpoint's own
     * matches. Overlapping occurrences are part of the endpoint's own phrasing.
     */
    private static boolean hasDisjointOccurrence(BoostTerm term, QueryText text, boolean[] covered) {
        for (List<String> form : term.getForms()) {
            for (int start : text.occurrences(form)) {
                boolean disjoint = true;
                for (int i = start; i < start + form.size(); i++) {
                    if (covered[i]) {
                        disjoint = false;
                        break;
                    }
                }
                if (disjoint) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void cover(boolean[] covered, List<Integer> starts, int length) {
        for (int start : starts) {
            for (int i = start; i < start + length; i++) {
                covered[i] = true;
            }
        }
    }
}
