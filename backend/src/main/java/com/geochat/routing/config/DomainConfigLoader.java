package com.geochat.routing.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geochat.routing.exception.DomainConfigException;
import com.geochat.routing.model.BoostTerm;
import com.geochat.routing.model.DomainConfig;
import com.geochat.routing.model.DomainConfig.EntityAlias;
import com.geochat.routing.model.DomainConfig.SynonymRule;
import com.geochat.routing.model.EndpointDescriptor;
import com.geochat.routing.model.EntityDefinition;
import com.geochat.routing.model.EntityType;
import com.geochat.routing.model.RejectionCategory;
import com.geochat.routing.text.QueryText;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads the domain configuration document and publishes it as an immutable snapshot.
 * Loading is all-or-nothing: any violation raises {@link DomainConfigException}, and a
 * failed reload leaves the active snapshot untouched.
 */
@Component
@Slf4j
public class DomainConfigLoader {

    static final Set<String> DEFAULT_STOPWORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with",
            "by", "from", "up", "about", "into", "through", "during", "before", "after",
            "above", "below", "among", "this", "that", "these", "those", "is", "are", "was",
            "were", "be", "been", "being", "have", "has", "had", "do", "does", "did", "will",
            "would", "should", "could", "can", "may", "might", "must", "shall", "me", "you",
            "him", "her", "it", "us", "them", "my", "your", "his", "its", "our", "their",
            "i", "we", "what", "which", "where", "how", "who", "why", "when", "show", "tell",
            "give", "please", "all", "most", "more");

    private final RoutingProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final AtomicReference<DomainConfig> active = new AtomicReference<>();

    public DomainConfigLoader(RoutingProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    @PostConstruct
    public void init() {
        DomainConfig config = load(properties.getConfigLocation());
        active.set(config);
        log.info("✅ Domain configuration '{}' v{} active: {} endpoints, {} synonyms, {} entities",
                config.getName(), config.getVersion(), config.getEndpoints().size(),
                config.getSynonyms().size(), config.getEntities().size());
    }

    /**
     * The snapshot every query should dereference exactly once.
     */
    public DomainConfig current() {
        DomainConfig config = active.get();
        if (config == null) {
            throw new IllegalStateException("No domain configuration loaded");
        }
        return config;
    }

    public boolean isLoaded() {
        return active.get() != null;
    }

    public DomainConfig reload() {
        return reload(properties.getConfigLocation());
    }

    /**
     * Builds a new snapshot from {@code location} and swaps it in only on success.
     */
    public DomainConfig reload(String location) {
        DomainConfig next;
        try {
            next = load(location);
        } catch (DomainConfigException e) {
            log.warn("⚠️  Configuration reload from {} rejected, keeping v{}: {}",
                    location, active.get() == null ? "-" : active.get().getVersion(), e.getMessage());
            throw e;
        }
        activate(next);
        return next;
    }

    /**
     * Publishes an already validated snapshot.
     */
    void activate(DomainConfig next) {
        DomainConfig previous = active.getAndSet(next);
        log.info("✅ Domain configuration reloaded: v{} -> v{}",
                previous == null ? "-" : previous.getVersion(), next.getVersion());
    }

    public DomainConfig load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new DomainConfigException("Domain configuration not found: " + location);
        }
        try (InputStream is = resource.getInputStream()) {
            return parse(is, location);
        } catch (IOException e) {
            throw new DomainConfigException("Cannot read domain configuration " + location + ": " + e.getMessage(), e);
        }
    }

    public DomainConfig parse(InputStream is, String source) {
        DomainConfigDocument document;
        try {
            document = objectMapper.readValue(is, DomainConfigDocument.class);
        } catch (JsonProcessingException e) {
            throw new DomainConfigException("Malformed domain configuration " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DomainConfigException("Cannot read domain configuration " + source + ": " + e.getMessage(), e);
        }
        if (document == null) {
            throw new DomainConfigException("Empty domain configuration: " + source);
        }
        log.debug("Parsed domain configuration from {}", source);
        return build(document);
    }

    DomainConfig build(DomainConfigDocument doc) {
        DomainConfigDocument.DomainInfo info = doc.getDomain();
        if (info == null || isBlank(info.getName()) || isBlank(info.getVersion())) {
            throw new DomainConfigException("Domain configuration must have a name and a version");
        }
        requireSections(doc);

        Set<String> stopwords = lowerAll(doc.getStopwords());
        if (stopwords.isEmpty()) {
            stopwords = DEFAULT_STOPWORDS;
        }

        Map<String, List<String>> synonyms = buildSynonyms(doc.getSynonyms());
        Map<String, String> variantToCanonical = new HashMap<>();
        List<SynonymRule> synonymRules = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : synonyms.entrySet()) {
            for (String variant : entry.getValue()) {
                String previous = variantToCanonical.putIfAbsent(variant, entry.getKey());
                if (previous != null && !previous.equals(entry.getKey())) {
                    throw new DomainConfigException("Synonym variant '" + variant
                            + "' maps to both '" + previous + "' and '" + entry.getKey() + "'");
                }
                synonymRules.add(new SynonymRule(QueryText.tokenize(variant), entry.getKey(),
                        QueryText.tokenize(entry.getKey())));
            }
        }
        synonymRules.sort(Comparator.comparingInt((SynonymRule r) -> r.getVariant().size()).reversed());

        Map<String, EntityDefinition> entities = new LinkedHashMap<>();
        addEntities(entities, doc.getEntities().getBrands(), EntityType.BRAND);
        addEntities(entities, doc.getEntities().getPlaces(), EntityType.PLACE);
        List<EntityAlias> aliases = buildAliases(entities);

        List<EndpointDescriptor> endpoints = buildEndpoints(doc.getEndpoints(), synonyms, variantToCanonical);

        Set<String> vocabulary = new HashSet<>();
        for (String term : doc.getVocabulary()) {
            vocabulary.addAll(QueryText.tokenize(term));
        }
        for (EndpointDescriptor endpoint : endpoints) {
            for (BoostTerm term : endpoint.getBoostTerms()) {
                term.getForms().forEach(vocabulary::addAll);
            }
            for (BoostTerm term : endpoint.getPenaltyTerms()) {
                vocabulary.addAll(term.getTokens());
            }
        }
        for (Map.Entry<String, List<String>> entry : synonyms.entrySet()) {
            vocabulary.addAll(QueryText.tokenize(entry.getKey()));
            entry.getValue().forEach(v -> vocabulary.addAll(QueryText.tokenize(v)));
        }
        aliases.forEach(a -> vocabulary.addAll(a.getTokens()));

        List<List<String>> relational = new ArrayList<>();
        for (String phrase : doc.getRelationalPhrases()) {
            List<String> tokens = QueryText.tokenize(phrase);
            if (!tokens.isEmpty()) {
                relational.add(tokens);
                vocabulary.addAll(tokens);
            }
        }

        Map<String, List<List<String>>> fieldAliases = buildFieldAliases(doc.getFieldAliases());
        fieldAliases.values().forEach(forms -> forms.forEach(vocabulary::addAll));
        vocabulary.removeAll(stopwords);

        return DomainConfig.builder()
                .name(info.getName())
                .version(info.getVersion())
                .description(info.getDescription())
                .endpoints(Collections.unmodifiableList(endpoints))
                .synonyms(Collections.unmodifiableMap(synonyms))
                .synonymRules(Collections.unmodifiableList(synonymRules))
                .entities(Collections.unmodifiableMap(entities))
                .entityAliases(Collections.unmodifiableList(aliases))
                .vocabularyTokens(Collections.unmodifiableSet(vocabulary))
                .stopwords(Collections.unmodifiableSet(stopwords))
                .relationalPhrases(Collections.unmodifiableList(relational))
                .fieldAliases(Collections.unmodifiableMap(fieldAliases))
                .rejectionCategories(buildRejectionCategories(doc.getRejectionPatterns()))
                .build();
    }

    /**
     * An explicit JSON null replaces the field default; reject it rather than fail later.
     */
    private static void requireSections(DomainConfigDocument doc) {
        requireSection(doc.getVocabulary(), "vocabulary");
        requireSection(doc.getStopwords(), "stopwords");
        requireSection(doc.getRelationalPhrases(), "relational_phrases");
        requireSection(doc.getSynonyms(), "synonyms");
        requireSection(doc.getEntities(), "entities");
        requireSection(doc.getEntities().getBrands(), "entities.brands");
        requireSection(doc.getEntities().getPlaces(), "entities.places");
        requireSection(doc.getFieldAliases(), "field_aliases");
        requireSection(doc.getRejectionPatterns(), "rejection_patterns");
    }

    private static void requireSection(Object section, String name) {
        if (section == null) {
            throw new DomainConfigException("Section '" + name + "' must not be null; omit it instead");
        }
    }

    private Map<String, List<String>> buildSynonyms(Map<String, List<String>> raw) {
        Map<String, List<String>> synonyms = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : raw.entrySet()) {
            String canonical = normalize(entry.getKey());
            if (canonical.isEmpty()) {
                throw new DomainConfigException("Synonym dictionary contains a blank canonical term");
            }
            if (synonyms.containsKey(canonical)) {
                throw new DomainConfigException("Duplicate synonym canonical term: '" + canonical + "'");
            }
            List<String> variants = new ArrayList<>();
            if (entry.getValue() != null) {
                for (String variant : entry.getValue()) {
                    String v = normalize(variant);
                    if (!v.isEmpty() && !v.equals(canonical) && !variants.contains(v)) {
                        variants.add(v);
                    }
                }
            }
            synonyms.put(canonical, List.copyOf(variants));
        }
        return synonyms;
    }

    private void addEntities(Map<String, EntityDefinition> target,
                             List<DomainConfigDocument.Entity> source, EntityType type) {
        for (DomainConfigDocument.Entity entity : source) {
            if (entity == null) {
                throw new DomainConfigException("Null " + type.getValue() + " entity entry");
            }
            String id = normalize(entity.getId());
            if (id.isEmpty()) {
                throw new DomainConfigException(type.getValue() + " entity without an id");
            }
            if (target.containsKey(id)) {
                throw new DomainConfigException("Duplicate entity id: '" + id + "'");
            }
            Set<String> surfaces = new LinkedHashSet<>();
            if (!isBlank(entity.getName())) {
                surfaces.add(normalize(entity.getName()));
            }
            if (entity.getAliases() != null) {
                entity.getAliases().stream().map(DomainConfigLoader::normalize)
                        .filter(a -> !a.isEmpty())
                        .forEach(surfaces::add);
            }
            if (surfaces.isEmpty()) {
                throw new DomainConfigException("Entity '" + id + "' has neither a name nor aliases");
            }
            String name = isBlank(entity.getName()) ? id : entity.getName().trim();
            target.put(id, new EntityDefinition(id, type, name,
                    type == EntityType.PLACE ? entity.getCode() : null, List.copyOf(surfaces)));
        }
    }

    private List<EntityAlias> buildAliases(Map<String, EntityDefinition> entities) {
        Map<List<String>, EntityDefinition> byTokens = new LinkedHashMap<>();
        for (EntityDefinition entity : entities.values()) {
            for (String alias : entity.getAliases()) {
                List<String> tokens = QueryText.tokenize(alias);
                if (tokens.isEmpty()) {
                    continue;
                }
                EntityDefinition previous = byTokens.putIfAbsent(tokens, entity);
                if (previous != null && !previous.getId().equals(entity.getId())) {
                    throw new DomainConfigException("Entity alias '" + alias + "' is claimed by both '"
                            + previous.getId() + "' and '" + entity.getId() + "'");
                }
            }
        }
        List<EntityAlias> aliases = new ArrayList<>();
        byTokens.forEach((tokens, entity) -> aliases.add(new EntityAlias(List.copyOf(tokens), entity)));
        aliases.sort(Comparator.comparingInt((EntityAlias a) -> a.getTokens().size()).reversed());
        return aliases;
    }

    private List<EndpointDescriptor> buildEndpoints(List<DomainConfigDocument.Endpoint> source,
                                                    Map<String, List<String>> synonyms,
                                                    Map<String, String> variantToCanonical) {
        if (source == null || source.isEmpty()) {
            throw new DomainConfigException("Domain configuration must define at least one endpoint");
        }
        Set<String> ids = new HashSet<>();
        List<EndpointDescriptor> endpoints = new ArrayList<>();
        for (DomainConfigDocument.Endpoint e : source) {
            if (e == null) {
                throw new DomainConfigException("Null endpoint entry");
            }
            if (isBlank(e.getId())) {
                throw new DomainConfigException("Endpoint without an id");
            }
            String id = e.getId().trim();
            if (!ids.add(id)) {
                throw new DomainConfigException("Duplicate endpoint id: " + id);
            }
            if (e.getBoostTerms() == null || e.getBoostTerms().isEmpty()) {
                throw new DomainConfigException("Endpoint " + id + " has an empty intent signature");
            }
            Double min = e.getMinConfidence();
            if (min == null || min.isNaN() || min <= 0.0 || min > 1.0) {
                throw new DomainConfigException("Endpoint " + id + " min_confidence must be in (0,1], got " + min);
            }

            EndpointDescriptor.EndpointDescriptorBuilder builder = EndpointDescriptor.builder()
                    .id(id)
                    .displayName(isBlank(e.getDisplayName()) ? id : e.getDisplayName())
                    .description(e.getDescription())
                    .minConfidence(min)
                    .priorityRank(e.getPriorityRank())
                    .comparative(e.isComparative())
                    .requiredFields(e.getRequiredFields() == null ? List.of() : e.getRequiredFields())
                    .exampleQueries(e.getExampleQueries() == null ? List.of() : e.getExampleQueries());

            if (e.getEntityTypes() == null) {
                builder.entityTypes(List.of(EntityType.values()));
            } else {
                for (String type : e.getEntityTypes()) {
                    builder.entityType(parseEntityType(id, type));
                }
            }

            Set<String> seenTerms = new HashSet<>();
            List<BoostTerm> ownTerms = new ArrayList<>();
            for (DomainConfigDocument.Term t : e.getBoostTerms()) {
                String term = t == null ? "" : normalize(t.getTerm());
                List<String> tokens = QueryText.tokenize(term);
                if (tokens.isEmpty()) {
                    throw new DomainConfigException("Endpoint " + id + " has a blank boost term");
                }
                if (!(t.getWeight() > 0.0) || Double.isInfinite(t.getWeight())) {
                    throw new DomainConfigException("Endpoint " + id + " term '" + term + "' needs a positive weight");
                }
                if (!seenTerms.add(term)) {
                    throw new DomainConfigException("Endpoint " + id + " repeats boost term '" + term + "'");
                }
                String category = isBlank(t.getCategory()) ? "general" : t.getCategory().trim();
                BoostTerm boost = new BoostTerm(term, t.getWeight(), category, tokens,
                        termForms(term, tokens, synonyms, variantToCanonical));
                ownTerms.add(boost);
                builder.boostTerm(boost);
            }
            addPenaltyTerms(builder, id, ownTerms, e.getPenaltyTerms(), synonyms, variantToCanonical);
            endpoints.add(builder.build());
        }
        return endpoints;
    }

    private void addPenaltyTerms(EndpointDescriptor.EndpointDescriptorBuilder builder, String id,
                                 List<BoostTerm> own, List<String> source,
                                 Map<String, List<String>> synonyms,
                                 Map<String, String> variantToCanonical) {
        if (source == null) {
            return;
        }
        double weight = properties.getIntent().getPenaltyTermWeight();
        Set<String> seen = new HashSet<>();
        for (String raw : source) {
            String term = normalize(raw);
            List<String> tokens = QueryText.tokenize(term);
            if (tokens.isEmpty() || !seen.add(term)) {
                continue;
            }
            List<List<String>> forms = termForms(term, tokens, synonyms, variantToCanonical);
            for (BoostTerm boost : own) {
                if (boost.getForms().stream().anyMatch(forms::contains)) {
                    throw new DomainConfigException("Endpoint " + id + " lists '" + term
                            + "' as both a boost term and a penalty term");
                }
            }
            builder.penaltyTerm(new BoostTerm(term, weight, "penalty", tokens, forms));
        }
    }

    /**
     * The term itself, its variants when it is canonical, and its canonical when it is a variant.
     */
    private List<List<String>> termForms(String term, List<String> tokens,
                                         Map<String, List<String>> synonyms,
                                         Map<String, String> variantToCanonical) {
        Set<List<String>> forms = new LinkedHashSet<>();
        forms.add(tokens);
        List<String> variants = synonyms.get(term);
        if (variants != null) {
            variants.forEach(v -> forms.add(QueryText.tokenize(v)));
        }
        String canonical = variantToCanonical.get(term);
        if (canonical != null) {
            forms.add(QueryText.tokenize(canonical));
        }
        forms.removeIf(List::isEmpty);
        return List.copyOf(forms);
    }

    private Map<String, List<List<String>>> buildFieldAliases(Map<String, List<String>> raw) {
        Map<String, List<List<String>>> out = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        for (Map.Entry<String, List<String>> entry : raw.entrySet()) {
            if (isBlank(entry.getKey()) || !seen.add(normalize(entry.getKey()))) {
                throw new DomainConfigException("Blank or duplicate field alias key: '" + entry.getKey() + "'");
            }
            List<List<String>> forms = new ArrayList<>();
            if (entry.getValue() != null) {
                for (String alias : entry.getValue()) {
                    List<String> tokens = QueryText.tokenize(alias);
                    if (!tokens.isEmpty()) {
                        forms.add(tokens);
                    }
                }
            }
            out.put(entry.getKey().trim(), List.copyOf(forms));
        }
        return out;
    }

    private List<RejectionCategory> buildRejectionCategories(Map<String, DomainConfigDocument.RejectionPatterns> raw) {
        List<RejectionCategory> categories = new ArrayList<>();
        for (Map.Entry<String, DomainConfigDocument.RejectionPatterns> entry : raw.entrySet()) {
            DomainConfigDocument.RejectionPatterns value = entry.getValue();
            if (value == null || !(value.getWeight() > 0.0)) {
                throw new DomainConfigException("Rejection category '" + entry.getKey() + "' needs a positive weight");
            }
            if (value.getPatterns() == null) {
                throw new DomainConfigException("Rejection category '" + entry.getKey() + "' has null patterns");
            }
            List<List<String>> patterns = new ArrayList<>();
            for (String pattern : value.getPatterns()) {
                List<String> tokens = QueryText.tokenize(pattern);
                if (!tokens.isEmpty()) {
                    patterns.add(tokens);
                }
            }
            categories.add(new RejectionCategory(entry.getKey(), value.getWeight(),
                    List.copyOf(patterns), value.getRedirect()));
        }
        return List.copyOf(categories);
    }

    private static EntityType parseEntityType(String endpointId, String raw) {
        for (EntityType type : EntityType.values()) {
            if (type.getValue().equalsIgnoreCase(raw == null ? "" : raw.trim())) {
                return type;
            }
        }
        throw new DomainConfigException("Endpoint " + endpointId + " has unknown entity type '" + raw + "'");
    }

    private static Set<String> lowerAll(List<String> values) {
        Set<String> out = new HashSet<>();
        if (values != null) {
            values.stream().map(DomainConfigLoader::normalize).filter(v -> !v.isEmpty()).forEach(out::add);
        }
        return out;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
