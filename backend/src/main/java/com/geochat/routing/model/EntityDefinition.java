package com.geochat.routing.model;

import lombok.Value;

import java.util.List;

/**
 * A named brand or place from the entity dictionaries.
 * Places carry the administrative code they resolve to.
 */
@Value
public class EntityDefinition {

    String id;

    EntityType type;

    String name;

    /**
     * Administrative code for places (e.g. a FSA or county FIPS code), null for brands.
     */
    String code;

    /**
     * Lower-cased surface forms, including the display name.
     */
    List<String> aliases;
}
