package com.geochat.routing.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Request model for /routing/route.
 */
@Data
public class RouteRequest {
    @NotBlank(message = "Question is required")
    @Size(max = 2000, message = "Question must be at most 2000 characters")
    private String question;

    /**
     * Earlier turns of the conversation, used only to rescue a terse follow-up.
     */
    private String conversationContext;

    private String fieldHint;
}
