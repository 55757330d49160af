package com.geochat.routing.service;

import com.geochat.routing.TestFixtures;
import com.geochat.routing.client.SimilarityScorer;
import com.geochat.routing.config.DomainConfigLoader;
import com.geochat.routing.config.RoutingProperties;
import com.geochat.routing.model.RecognizedEntity;
import com.geochat.routing.model.ResponseType;
import com.geochat.routing.model.RoutingLayer;
import com.geochat.routing.model.RoutingQuery;
import com.geochat.routing.model.RoutingResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvFileSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * End-to-end routing over the fixture domain, with the similarity backend mocked.
 */
@ExtendWith(MockitoExtension.class)
class HybridRoutingEngineTest {

    private static final String COMPARE = "compare Nike and Adidas market share";

    @Mock
    private SimilarityScorer similarityScorer;

    private RoutingProperties properties;
    private RoutingMetricsService metrics;
    private HybridRoutingEngine engine;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        DomainConfigLoader configLoader = TestFixtures.configLoader(properties);
        configLoader.init();
        EntityRecognizer recognizer = new EntityRecognizer();
        ContextEnhancementService context = new ContextEnhancementService(properties,
                TestFixtures.fieldInventory(properties));
        metrics = new RoutingMetricsService();
        engine = new HybridRoutingEngine(
                configLoader,
                properties,
                new ScopeValidator(properties, recognizer),
                recognizer,
                new IntentClassifier(properties, recognizer),
                new DomainAdaptationService(recognizer),
                new SemanticEnhancer(properties, similarityScorer),
                context,
                new ConfidenceAggregator(properties, context),
                metrics);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Scenarios
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should route a brand comparison to the comparative endpoint with both brands")
    void route_shouldRouteComparison() {
        RoutingResult result = engine.route(RoutingQuery.of(COMPARE));

        assertTrue(result.isSuccess());
        assertEquals("/comparative-analysis", result.getEndpoint());
        assertEquals(1.0, result.getConfidence(), 1e-9);
        assertEquals(List.of("nike", "adidas"), result.getMatchedEntities().stream()
                .map(RecognizedEntity::getCanonicalId).collect(Collectors.toList()));
        assertEquals(List.of(RoutingLayer.VALIDATION, RoutingLayer.INTENT_CLASSIFICATION,
                RoutingLayer.DOMAIN_ADAPTATION, RoutingLayer.CONTEXT_ENHANCEMENT,
                RoutingLayer.CONFIDENCE_MANAGEMENT), result.getLayersExecuted());
        assertEquals(RoutingResult.EARLY_EXIT_SEMANTIC_UNAVAILABLE, result.getEarlyExit());
        assertEquals("/brand-analysis", result.getAlternatives().get(0).getEndpointId());
    }

    @Test
    @DisplayName("Should stop after validation for gibberish")
    void route_shouldShortCircuitGibberish() {
        RoutingResult result = engine.route(RoutingQuery.of("asdkj qweroi"));

        assertFalse(result.isSuccess());
        assertNull(result.getEndpoint());
        assertEquals(1.0, result.getValidation().getConfidence());
        assertEquals(List.of(RoutingLayer.VALIDATION), result.getLayersExecuted());
        assertEquals(RoutingResult.EARLY_EXIT_VALIDATION_REJECTED, result.getEarlyExit());
        assertEquals(ResponseType.REJECTED, result.getUserResponse().getType());
        verifyNoInteractions(similarityScorer);
    }

    @Test
    @DisplayName("Should reject an in-scope query that matches no endpoint")
    void route_shouldRejectWithoutCandidates() {
        RoutingResult result = engine.route(new RoutingQuery("what about the numbers over there",
                "show demographics for Toronto", null));

        assertTrue(result.getValidation().isInScope());
        assertFalse(result.isSuccess());
        assertEquals(RoutingResult.EARLY_EXIT_NO_CANDIDATES, result.getEarlyExit());
        assertFalse(result.getLayersExecuted().contains(RoutingLayer.CONTEXT_ENHANCEMENT));
        assertEquals(RoutingLayer.CONFIDENCE_MANAGEMENT,
                result.getLayersExecuted().get(result.getLayersExecuted().size() - 1));
    }

    @Test
    @DisplayName("Should produce identical results for identical queries")
    void route_shouldBeDeterministic() {
        assertEquals(engine.route(RoutingQuery.of(COMPARE)), engine.route(RoutingQuery.of(COMPARE)));
    }

    @Test
    @DisplayName("Should give the same keyword-only result whether semantic is failing or not configured")
    void route_shouldDegradeTransparently() {
        properties.getSemantic().getGate().setEnabled(false);
        RoutingResult notConfigured = engine.route(RoutingQuery.of(COMPARE));

        when(similarityScorer.isConfigured()).thenReturn(true);
        when(similarityScorer.score(anyString(), anyList()))
                .thenThrow(new IllegalStateException(new TimeoutException("Did not observe any item")));
        RoutingResult failing = engine.route(RoutingQuery.of(COMPARE));

        assertEquals(notConfigured, failing);
    }

    @Test
    @DisplayName("Should run the semantic layer and blend scores when the backend answers")
    void route_shouldUseSemanticScores() {
        properties.getSemantic().getGate().setEnabled(false);
        when(similarityScorer.isConfigured()).thenReturn(true);
        when(similarityScorer.score(eq("compare nike and adidas market share"), anyList()))
                .thenReturn(Map.of("/comparative-analysis", 0.0, "/brand-analysis", 1.0));

        RoutingResult result = engine.route(RoutingQuery.of(COMPARE));

        assertTrue(result.getLayersExecuted().contains(RoutingLayer.SEMANTIC_ENHANCEMENT));
        assertNull(result.getEarlyExit());
        assertEquals("/comparative-analysis", result.getEndpoint());
        // blended 0.7 x 1.0 + 0.3 x 0.0, plus the market_share mention boost
        assertEquals(0.75, result.getConfidence(), 1e-9);
    }

    @Test
    @DisplayName("Should send the synonym-normalised query to the similarity backend")
    void route_shouldScoreEnhancedQuery() {
        properties.getSemantic().getGate().setEnabled(false);
        when(similarityScorer.isConfigured()).thenReturn(true);
        when(similarityScorer.score(anyString(), anyList())).thenReturn(Map.of("/brand-analysis", 0.5));

        engine.route(RoutingQuery.of("compare Nike and Adidas brand share"));

        verify(similarityScorer).score(eq("compare nike and adidas market share"), anyList());
    }

    @Test
    @DisplayName("Should skip the similarity backend for a confident keyword leader without degrading")
    void route_shouldSkipSemanticForConfidentLeader() {
        when(similarityScorer.isConfigured()).thenReturn(true);

        RoutingResult result = engine.route(RoutingQuery.of(COMPARE));

        verify(similarityScorer, never()).score(anyString(), anyList());
        assertEquals("/comparative-analysis", result.getEndpoint());
        assertEquals(1.0, result.getConfidence(), 1e-9);
        assertNull(result.getEarlyExit());
        assertFalse(result.getLayersExecuted().contains(RoutingLayer.SEMANTIC_ENHANCEMENT));
        assertTrue(result.getReasoning().stream()
                .anyMatch(line -> line.contains("Skipped: keyword leader /comparative-analysis")));
    }

    @Test
    @DisplayName("Should use the field hint as an explicit field mention")
    void route_shouldApplyFieldHint() {
        RoutingResult plain = engine.route(RoutingQuery.of("show demographics for Toronto"));
        RoutingResult hinted = engine.route(new RoutingQuery("show demographics for Toronto", null, "population"));

        assertEquals(plain.getConfidence() + 0.05, hinted.getConfidence(), 1e-9);
    }

    @Test
    @DisplayName("Should record every routed query in the metrics")
    void route_shouldRecordMetrics() {
        engine.route(RoutingQuery.of(COMPARE));
        engine.route(RoutingQuery.of("asdkj qweroi"));

        assertEquals(2, metrics.getTotalQueries());
        assertEquals(1, metrics.getRoutedQueries());
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Expectation table
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @ParameterizedTest(name = "{0} -> {1} {2}")
    @CsvFileSource(resources = "/routing-expectations.csv")
    @DisplayName("Should match the expected outcome for each fixture query")
    void route_shouldMatchExpectationTable(String question, String expectedType, String expectedEndpoint) {
        RoutingResult result = engine.route(RoutingQuery.of(question));

        assertEquals(expectedType, result.getUserResponse().getType().getValue(), result.getReasoning().toString());
        assertEquals(expectedEndpoint, result.getEndpoint());
        assertEquals(expectedEndpoint != null, result.isSuccess());
    }
}
