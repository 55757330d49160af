package com.geochat.routing.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ConfigSummary {

    String name;

    String version;

    int endpoints;

    int synonyms;

    int brands;

    int places;

    List<String> rejectionCategories;

    public static ConfigSummary of(DomainConfig config) {
        long brands = config.getEntities().values().stream()
                .filter(e -> e.getType() == EntityType.BRAND)
                .count();
        return ConfigSummary.builder()
                .name(config.getName())
                .version(config.getVersion())
                .endpoints(config.getEndpoints().size())
                .synonyms(config.getSynonyms().size())
                .brands((int) brands)
                .places(config.getEntities().size() - (int) brands)
                .rejectionCategories(config.getRejectionCategories().stream()
                        .map(RejectionCategory::getName)
                        .toList())
                .build();
    }
}
