package com.geochat.routing.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the routing domain: endpoints, vocabulary, synonyms and
 * entity dictionaries. A reload builds a new instance; nothing mutates one in place.
 */
@Value
@Builder
public class DomainConfig {

    String name;

    String version;

    String description;

    /**
     * Endpoints in document order.
     */
    List<EndpointDescriptor> endpoints;

    /**
     * canonical term -> variants, all lower-cased.
     */
    Map<String, List<String>> synonyms;

    /**
     * Variant token sequences mapped to their canonical token sequence, longest variant first.
     */
    List<SynonymRule> synonymRules;

    /**
     * canonical id -> entity, brands and places together.
     */
    Map<String, EntityDefinition> entities;

    /**
     * Alias token sequences, longest first, for greedy whole-token recognition.
     */
    List<EntityAlias> entityAliases;

    /**
     * Single tokens that count as "about our domain": explicit vocabulary plus
     * every boost-term, synonym and entity-alias token.
     */
    Set<String> vocabularyTokens;

    Set<String> stopwords;

    List<List<String>> relationalPhrases;

    /**
     * data field name -> tokenized aliases a user might type for it.
     */
    Map<String, List<List<String>>> fieldAliases;

    List<RejectionCategory> rejectionCategories;

    public Optional<EndpointDescriptor> findEndpoint(String id) {
        return endpoints.stream().filter(e -> e.getId().equals(id)).findFirst();
    }

    public boolean isStopword(String token) {
        return stopwords.contains(token);
    }

    public boolean isVocabulary(String token) {
        return vocabularyTokens.contains(token);
    }

    @Value
    public static class SynonymRule {
        List<String> variant;
        String canonical;
        List<String> canonicalTokens;
    }

    @Value
    public static class EntityAlias {
        List<String> tokens;
        EntityDefinition entity;
    }
}
