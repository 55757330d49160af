package com.geochat.routing.model;

import lombok.Value;

/**
 * An entity found in the query text; {@code start}/{@code end} are character offsets
 * into the raw query (end exclusive).
 */
@Value
public class RecognizedEntity {

    String canonicalId;

    EntityType type;

    String surface;

    String code;

    int start;

    int end;
}
