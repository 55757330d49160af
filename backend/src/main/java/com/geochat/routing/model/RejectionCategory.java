package com.geochat.routing.model;

import lombok.Value;

import java.util.List;

/**
 * Off-topic pattern group used by the scope validator.
 */
@Value
public class RejectionCategory {

    String name;

    double weight;

    List<List<String>> patterns;

    String redirectMessage;
}
