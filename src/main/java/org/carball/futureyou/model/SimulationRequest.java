package org.carball.futureyou.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * What the caller wants simulated, as read from the input file or collected interactively.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimulationRequest {

    public static final List<String> DEFAULT_TIMELINES = List.of("1yr", "3yr", "5yr");

    @JsonProperty("user_profile")
    private Map<String, Object> userProfile;

    @JsonProperty("decision")
    private String decision;

    @Builder.Default
    @JsonProperty("timelines")
    private List<String> timelines = new ArrayList<>(DEFAULT_TIMELINES);

    @JsonProperty("generate_visuals")
    private boolean generateVisuals;
}
