package com.geochat.routing.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class FieldRequirements {

    @Singular("requiredField")
    Set<String> required;

    @Singular("availableField")
    Set<String> available;

    @Singular("missingField")
    Set<String> missing;

    @Singular("mentionedField")
    Set<String> mentioned;
}
