package org.carball.futureyou.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConversationTurn(
        @JsonProperty("role") String role,
        @JsonProperty("text") String text
) {}
