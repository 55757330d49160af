package com.geochat.routing.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class UserResponse {

    ResponseType type;

    String message;

    @Singular
    List<String> suggestions;
}
