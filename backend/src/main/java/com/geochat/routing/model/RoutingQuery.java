package com.geochat.routing.model;

import lombok.Value;

/**
 * The single input to the router.
 */
@Value
public class RoutingQuery {

    String text;

    /**
     * Prior turns, consulted only when scope is borderline.
     */
    String conversationContext;

    /**
     * Optional target-variable hint from the caller, treated as an explicit field mention.
     */
    String fieldHint;

    public static RoutingQuery of(String text) {
        return new RoutingQuery(text, null, null);
    }
}
