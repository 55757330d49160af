package com.geochat.routing.model;

import lombok.Value;

@Value
public class Alternative {

    String endpointId;

    double score;
}
