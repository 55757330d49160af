package com.geochat.routing.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wire form of domain-config.json. Converted into an immutable
 * {@link com.geochat.routing.model.DomainConfig} by {@link DomainConfigLoader}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DomainConfigDocument {

    @JsonProperty("domain")
    private DomainInfo domain;

    @JsonProperty("vocabulary")
    private List<String> vocabulary = new ArrayList<>();

    @JsonProperty("stopwords")
    private List<String> stopwords = new ArrayList<>();

    @JsonProperty("relational_phrases")
    private List<String> relationalPhrases = new ArrayList<>();

    @JsonProperty("synonyms")
    private Map<String, List<String>> synonyms = new LinkedHashMap<>();

    @JsonProperty("entities")
    private Entities entities = new Entities();

    @JsonProperty("field_aliases")
    private Map<String, List<String>> fieldAliases = new LinkedHashMap<>();

    @JsonProperty("rejection_patterns")
    private Map<String, RejectionPatterns> rejectionPatterns = new LinkedHashMap<>();

    @JsonProperty("endpoints")
    private List<Endpoint> endpoints = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DomainInfo {
        @JsonProperty("name")
        private String name;

        @JsonProperty("version")
        private String version;

        @JsonProperty("description")
        private String description;
    }

    @Data
    @NoArgsConstructor
    public static class Entities {
        @JsonProperty("brands")
        private List<Entity> brands = new ArrayList<>();

        @JsonProperty("places")
        private List<Entity> places = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entity {
        @JsonProperty("id")
        private String id;

        @JsonProperty("name")
        private String name;

        @JsonProperty("aliases")
        private List<String> aliases = new ArrayList<>();

        @JsonProperty("code")
        private String code;  // places only
    }

    @Data
    @NoArgsConstructor
    public static class RejectionPatterns {
        @JsonProperty("weight")
        private double weight;

        @JsonProperty("patterns")
        private List<String> patterns = new ArrayList<>();

        @JsonProperty("redirect")
        private String redirect;
    }

    @Data
    @NoArgsConstructor
    public static class Endpoint {
        @JsonProperty("id")
        private String id;

        @JsonProperty("display_name")
        private String displayName;

        @JsonProperty("description")
        private String description;

        @JsonProperty("min_confidence")
        private Double minConfidence;

        @JsonProperty("priority_rank")
        private int priorityRank = Integer.MAX_VALUE;

        @JsonProperty("comparative")
        private boolean comparative;

        @JsonProperty("entity_types")
        private List<String> entityTypes;  // null means every type

        @JsonProperty("required_fields")
        private List<String> requiredFields = new ArrayList<>();

        @JsonProperty("example_queries")
        private List<String> exampleQueries = new ArrayList<>();

        @JsonProperty("boost_terms")
        private List<Term> boostTerms = new ArrayList<>();

        @JsonProperty("penalty_terms")
        private List<String> penaltyTerms = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Term {
        @JsonProperty("term")
        private String term;

        @JsonProperty("weight")
        private double weight = 1.0;

        @JsonProperty("category")
        private String category = "general";
    }
}
