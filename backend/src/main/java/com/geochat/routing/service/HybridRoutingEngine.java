package com.geochat.routing.service;

import com.geochat.routing.config.DomainConfigLoader;
import com.geochat.routing.config.RoutingProperties;
import com.geochat.routing.model.ContextEnhancement;
import com.geochat.routing.model.DomainConfig;
import com.geochat.routing.model.DomainEnhancement;
import com.geochat.routing.model.EndpointCandidate;
import com.geochat.routing.model.EndpointDescriptor;
import com.geochat.routing.model.RecognizedEntity;
import com.geochat.routing.model.RoutingLayer;
import com.geochat.routing.model.RoutingQuery;
import com.geochat.routing.model.RoutingResult;
import com.geochat.routing.model.SemanticEnhancement;
import com.geochat.routing.model.ValidationResult;
import com.geochat.routing.text.QueryText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the routing layers in order against one configuration snapshot:
 * validation, intent classification, domain adaptation, semantic enhancement,
 * context enhancement and confidence management.
 */
@Service
@Slf4j
public class HybridRoutingEngine {

    private final DomainConfigLoader configLoader;
    private final RoutingProperties properties;
    private final ScopeValidator scopeValidator;
    private final EntityRecognizer entityRecognizer;
    private final IntentClassifier intentClassifier;
    private final DomainAdaptationService domainAdaptation;
    private final SemanticEnhancer semanticEnhancer;
    private final ContextEnhancementService contextEnhancement;
    private final ConfidenceAggregator aggregator;
    private final RoutingMetricsService metrics;

    public HybridRoutingEngine(DomainConfigLoader configLoader,
                               RoutingProperties properties,
                               ScopeValidator scopeValidator,
                               EntityRecognizer entityRecognizer,
                               IntentClassifier intentClassifier,
                               DomainAdaptationService domainAdaptation,
                               SemanticEnhancer semanticEnhancer,
                               ContextEnhancementService contextEnhancement,
                               ConfidenceAggregator aggregator,
                               RoutingMetricsService metrics) {
        this.configLoader = configLoader;
        this.properties = properties;
        this.scopeValidator = scopeValidator;
        this.entityRecognizer = entityRecognizer;
        this.intentClassifier = intentClassifier;
        this.domainAdaptation = domainAdaptation;
        this.semanticEnhancer = semanticEnhancer;
        this.contextEnhancement = contextEnhancement;
        this.aggregator = aggregator;
        this.metrics = metrics;
    }

    public RoutingResult route(String question, String conversationContext, String fieldHint) {
        return route(new RoutingQuery(question, conversationContext, fieldHint));
    }

    public RoutingResult route(RoutingQuery query) {
        long start = System.currentTimeMillis();
        // one snapshot for the whole query; a concurrent reload does not affect it
        DomainConfig config = configLoader.current();
        RoutingResult result = route(query, config);
        long latency = System.currentTimeMillis() - start;
        metrics.recordRoute(result, latency);

        if (result.isSuccess()) {
            log.info("✅ Routed to {} (confidence {}) in {}ms",
                    result.getEndpoint(), String.format("%.2f", result.getConfidence()), latency);
        } else {
            log.info("↩️ Not routed: {} (earlyExit={}) in {}ms",
                    result.getUserResponse().getType().getValue(), result.getEarlyExit(), latency);
        }
        return result;
    }

    RoutingResult route(RoutingQuery query, DomainConfig config) {
        RoutingTrace trace = RoutingTrace.empty();

        ValidationResult validation = scopeValidator.validate(query, config);
        trace = trace.append(RoutingLayer.VALIDATION, validation.getReasons());
        if (!validation.isInScope()) {
            return aggregator.reject(validation, trace.exit(RoutingResult.EARLY_EXIT_VALIDATION_REJECTED));
        }

        QueryText text = QueryText.of(query.getText());
        List<RecognizedEntity> entities = entityRecognizer.recognize(text, config);

        List<EndpointCandidate> candidates = intentClassifier.classify(text, entities, config);
        trace = trace.append(RoutingLayer.INTENT_CLASSIFICATION, intentLines(candidates));

        DomainEnhancement domain = domainAdaptation.enhance(text, entities, config);
        trace = trace.append(RoutingLayer.DOMAIN_ADAPTATION, domain.getReasoning());

        if (candidates.isEmpty()) {
            return aggregator.decide(validation, candidates, domain, SemanticEnhancement.unavailable(
                    SemanticEnhancer.NOT_CONFIGURED), Map.of(), config,
                    trace.exit(RoutingResult.EARLY_EXIT_NO_CANDIDATES));
        }

        List<EndpointCandidate> ranked = candidates;
        // the backend sees the synonym-normalised query
        SemanticEnhancement semantic = semanticEnhancer.enhance(domain.getEnhancedQuery(), candidates);
        if (semantic.isAvailable()) {
            ranked = semantic.getCandidates();
            trace = trace.append(RoutingLayer.SEMANTIC_ENHANCEMENT, List.of(semantic.getTrace()));
        } else if (semantic.isSkipped()) {
            trace = trace.note(RoutingLayer.SEMANTIC_ENHANCEMENT, semantic.getTrace());
        } else {
            log.debug("Semantic enhancement unavailable: {}", semantic.getUnavailableReason());
            trace = trace.note(RoutingLayer.SEMANTIC_ENHANCEMENT, semantic.getTrace())
                    .exit(RoutingResult.EARLY_EXIT_SEMANTIC_UNAVAILABLE);
        }

        Map<String, ContextEnhancement> contexts = new LinkedHashMap<>();
        List<String> contextLines = new ArrayList<>();
        int window = Math.min(properties.getContext().getMaxCandidates(), ranked.size());
        for (int i = 0; i < window; i++) {
            Optional<EndpointDescriptor> endpoint = config.findEndpoint(ranked.get(i).getEndpointId());
            if (endpoint.isEmpty()) {
                continue;
            }
            ContextEnhancement context = contextEnhancement.enhance(endpoint.get(), text, query.getFieldHint(), config);
            contexts.put(context.getEndpointId(), context);
            contextLines.add(String.format("%s: coverage %.2f, boost %.2f%s",
                    context.getEndpointId(), context.getCoverageScore(), context.getContextualBoost(),
                    context.getFieldRequirements().getMissing().isEmpty() ? ""
                            : ", missing " + context.getFieldRequirements().getMissing()));
        }
        trace = trace.append(RoutingLayer.CONTEXT_ENHANCEMENT, contextLines);

        return aggregator.decide(validation, ranked, domain, semantic, contexts, config, trace);
    }

    private static List<String> intentLines(List<EndpointCandidate> candidates) {
        if (candidates.isEmpty()) {
            return List.of("No endpoint signature matched");
        }
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < Math.min(3, candidates.size()); i++) {
            lines.add(candidates.get(i).getReasoning());
        }
        return lines;
    }
}
