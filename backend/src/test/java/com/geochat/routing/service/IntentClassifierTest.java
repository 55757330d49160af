package com.geochat.routing.service;

import com.geochat.routing.TestFixtures;
import com.geochat.routing.config.RoutingProperties;
import com.geochat.routing.model.DomainConfig;
import com.geochat.routing.model.EndpointCandidate;
import com.geochat.routing.model.RoutingQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class IntentClassifierTest {

    private RoutingProperties properties;
    private IntentClassifier classifier;
    private DomainConfig config;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        classifier = new IntentClassifier(properties, new EntityRecognizer());
        config = TestFixtures.domainConfig();
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Scoring
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should rank the comparative endpoint first for a brand comparison")
    void classify_shouldRankComparisonFirst() {
        List<EndpointCandidate> candidates = classify("compare Nike and Adidas market share");

        EndpointCandidate top = candidates.get(0);
        assertEquals("/comparative-analysis", top.getEndpointId());
        // compare 2.0 + market share 1.5 x 1.5 + two entities + one relational phrase
        assertEquals(5.65, top.getRawScore(), 1e-9);
        assertEquals(1.0, top.getNormalizedScore(), 1e-9);
        assertEquals(List.of("compare", "market share"), top.getMatchedTerms());
        assertEquals(List.of("nike", "adidas"), top.getMatchedEntities());
        assertEquals("/brand-analysis", candidates.get(1).getEndpointId());
    }

    @Test
    @DisplayName("Should give contiguous phrases more weight than scattered tokens")
    void classify_shouldApplyPhraseMultiplier() {
        double contiguous = score("market share for Nike", "/comparative-analysis");
        double scattered = score("share of the market for Nike", "/comparative-analysis");

        assertEquals(2.75, contiguous, 1e-9);
        assertEquals(2.0, scattered, 1e-9);
    }

    @Test
    @DisplayName("Should match a term through its synonyms")
    void classify_shouldMatchSynonymForms() {
        EndpointCandidate top = classify("strategic opportunity in top markets").get(0);

        assertEquals("/strategic-analysis", top.getEndpointId());
        assertEquals(List.of("strategy", "opportunity", "top markets"), top.getMatchedTerms());
        assertEquals(1.0, top.getNormalizedScore(), 1e-9);
    }

    @Test
    @DisplayName("Should subtract a penalty for terms owned by other endpoints")
    void classify_shouldPenalizeForeignTerms() {
        double clean = score("brand performance for Nike", "/brand-analysis");
        double mixed = score("brand performance accuracy for Nike", "/brand-analysis");

        assertEquals(3.0, clean, 1e-9);
        assertEquals(3.0 - 0.25 * 2.0, mixed, 1e-9);
    }

    @Test
    @DisplayName("Should subtract the endpoint's own penalty terms")
    void classify_shouldApplyPenaltyTerms() {
        EndpointCandidate brand = candidate("brand performance for Nike versus Adidas", "/brand-analysis")
                .orElseThrow();

        // brand 1.0 + performance 1.5 + two brand entities, minus one penalty term
        assertEquals(3.5 - 0.5, brand.getRawScore(), 1e-9);
        assertTrue(brand.getReasoning().contains("penalty terms -0.50 [versus]"));
        assertEquals(3.0, score("brand performance for Nike", "/brand-analysis"), 1e-9);
    }

    @Test
    @DisplayName("Should only award entity bonuses for the endpoint's entity types")
    void classify_shouldFilterEntityTypes() {
        EndpointCandidate demographic = candidate("demographics for Nike", "/demographic-insights").orElseThrow();

        assertEquals(2.0, demographic.getRawScore(), 1e-9);
        assertTrue(demographic.getMatchedEntities().isEmpty());
    }

    @Test
    @DisplayName("Should not produce candidates from entities alone")
    void classify_shouldRequireSignatureMatch() {
        assertTrue(classify("Nike and Adidas in Toronto").isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"brand", "performance", "market share", "brand share"})
    @DisplayName("Should never lower an endpoint's score when one of its own terms is added")
    void classify_shouldBeMonotonic(String addedTerm) {
        for (String base : List.of("brand performance accuracy for Nike", "compare Puma accuracy",
                "model accuracy for Adidas", "share of the market")) {
            double before = score(base, "/brand-analysis");
            double after = score(base + " " + addedTerm, "/brand-analysis");
            assertTrue(after >= before, base + " + " + addedTerm + ": " + after + " < " + before);
        }
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Ranking
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should break score ties by category breadth before priority")
    void classify_shouldPreferBroaderCategories() {
        properties.getIntent().setCrossEndpointPenalty(0.0);
        DomainConfig tied = TestFixtures.parse(("{'domain': {'name': 't', 'version': '1'}, 'endpoints': ["
                + "{'id': '/x', 'min_confidence': 0.3, 'priority_rank': 1, "
                + "'boost_terms': [{'term': 'sales', 'weight': 1.0, 'category': 'subject'}]}, "
                + "{'id': '/y', 'min_confidence': 0.3, 'priority_rank': 5, "
                + "'boost_terms': [{'term': 'sales', 'weight': 0.5, 'category': 'subject'}, "
                + "{'term': 'growth', 'weight': 0.5, 'category': 'quality'}]}]}").replace('\'', '"'));

        List<EndpointCandidate> candidates = classifier.classify(RoutingQuery.of("sales growth"), tied);

        assertEquals(candidates.get(0).getRawScore(), candidates.get(1).getRawScore(), 1e-9);
        assertEquals("/y", candidates.get(0).getEndpointId());
    }

    @Test
    @DisplayName("Should break remaining ties by priority rank, then id")
    void classify_shouldUsePriorityThenId() {
        DomainConfig tied = TestFixtures.parse(("{'domain': {'name': 't', 'version': '1'}, 'endpoints': ["
                + "{'id': '/c', 'min_confidence': 0.3, 'priority_rank': 2, 'boost_terms': [{'term': 'sales'}]}, "
                + "{'id': '/b', 'min_confidence': 0.3, 'priority_rank': 1, 'boost_terms': [{'term': 'sales'}]}, "
                + "{'id': '/a', 'min_confidence': 0.3, 'priority_rank': 2, 'boost_terms': [{'term': 'sales'}]}]}")
                .replace('\'', '"'));

        List<EndpointCandidate> candidates = classifier.classify(RoutingQuery.of("sales numbers"), tied);

        assertEquals(List.of("/b", "/a", "/c"),
                candidates.stream().map(EndpointCandidate::getEndpointId).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Should normalise against the strongest few signature terms")
    void maxScore_shouldSaturate() {
        double max = classifier.maxScore(config.findEndpoint("/comparative-analysis").orElseThrow(), config);

        // 2.25 (market share as a phrase) + 2.0 + 1.0 + relational bonus 0.4
        assertEquals(5.65, max, 1e-9);
    }

    private List<EndpointCandidate> classify(String query) {
        return classifier.classify(RoutingQuery.of(query), config);
    }

    private Optional<EndpointCandidate> candidate(String query, String endpointId) {
        return classify(query).stream().filter(c -> c.getEndpointId().equals(endpointId)).findFirst();
    }

    private double score(String query, String endpointId) {
        return candidate(query, endpointId).map(EndpointCandidate::getRawScore).orElse(0.0);
    }
}
