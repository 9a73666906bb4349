package org.carball.futureyou.tracker;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * A decision the user actually made, with the path they chose.
 */
public record DecisionRecord(
        @JsonProperty("timestamp") LocalDateTime timestamp,
        @JsonProperty("decision") String decision,
        @JsonProperty("chosen_path") String chosenPath,
        @JsonProperty("reasoning") String reasoning
) {}
