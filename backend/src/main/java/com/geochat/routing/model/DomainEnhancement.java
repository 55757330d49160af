package com.geochat.routing.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DomainEnhancement {

    /**
     * Query with synonym variants replaced by canonical terms; internal only.
     */
    String enhancedQuery;

    double domainRelevance;

    @Singular("entity")
    List<RecognizedEntity> entityContext;

    @Singular("trace")
    List<String> reasoning;
}
