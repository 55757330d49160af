package com.geochat.routing.model;

import lombok.Value;

import java.util.List;

/**
 * One weighted term or phrase of an endpoint's intent signature.
 * {@code forms} holds the tokenized term plus every synonym-equivalent
 * token sequence, resolved once at configuration load.
 */
@Value
public class BoostTerm {

    String term;

    double weight;

    /**
     * Signature category (subject, analysis, scope, quality...), used for tie-breaks.
     */
    String category;

    List<String> tokens;

    List<List<String>> forms;

    public boolean isPhrase() {
        return tokens.size() > 1;
    }
}
