package com.geochat.routing.service;

import com.geochat.routing.config.RoutingProperties;
import com.geochat.routing.model.ContextEnhancement;
import com.geochat.routing.model.DomainConfig;
import com.geochat.routing.model.EndpointDescriptor;
import com.geochat.routing.model.FieldRequirements;
import com.geochat.routing.text.QueryText;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a candidate endpoint's required data fields against the live field inventory,
 * and rewards queries that name those fields explicitly.
 */
@Service
public class ContextEnhancementService {

    private final RoutingProperties properties;
    private final FieldInventory fieldInventory;

    public ContextEnhancementService(RoutingProperties properties, FieldInventory fieldInventory) {
        this.properties = properties;
        this.fieldInventory = fieldInventory;
    }

    public ContextEnhancement enhance(EndpointDescriptor endpoint, QueryText text, String fieldHint,
                                      DomainConfig config) {
        FieldRequirements.FieldRequirementsBuilder requirements = FieldRequirements.builder();
        int available = 0;
        int mentioned = 0;
        for (String field : endpoint.getRequiredFields()) {
            requirements.requiredField(field);
            if (fieldInventory.hasField(endpoint.getId(), field)) {
                requirements.availableField(field);
                available++;
            } else {
                requirements.missingField(field);
            }
            if (isMentioned(field, text, fieldHint, config)) {
                requirements.mentionedField(field);
                mentioned++;
            }
        }

        int required = endpoint.getRequiredFields().size();
        double coverage = required == 0 ? 1.0 : (double) available / required;
        RoutingProperties.Context context = properties.getContext();
        double boost = Math.min(context.getMaxContextualBoost(), mentioned * context.getFieldMentionBoost());
        return new ContextEnhancement(endpoint.getId(), coverage, boost, requirements.build());
    }

    /**
     * Whether the endpoint may be routed to given its data coverage.
     */
    public boolean isAvailable(ContextEnhancement enhancement) {
        if (enhancement.hasNoCoverage()) {
            return false;
        }
        return !properties.getContext().isRequireFullCoverage() || enhancement.isFullyCovered();
    }

    private static boolean isMentioned(String field, QueryText text, String fieldHint, DomainConfig config) {
        List<List<String>> forms = new ArrayList<>();
        forms.add(QueryText.tokenize(field.replace('_', ' ')));
        forms.addAll(config.getFieldAliases().getOrDefault(field, List.of()));

        for (List<String> form : forms) {
            if (!form.isEmpty() && text.containsPhrase(form)) {
                return true;
            }
        }
        if (fieldHint == null || fieldHint.isBlank()) {
            return false;
        }
        if (fieldHint.trim().equalsIgnoreCase(field)) {
            return true;
        }
        List<String> hint = QueryText.tokenize(fieldHint.replace('_', ' '));
        return forms.contains(hint);
    }
}
