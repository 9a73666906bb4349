package org.carball.futureyou.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Profile of the person whose decision is being simulated.
 * Keys outside the known set (location, education, salary...) are kept in {@link #getAttributes()}
 * so they still reach the Profiler prompt and the reports.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class UserProfile {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("age")
    private Integer age;

    @JsonProperty("current_role")
    private String currentRole;

    @Builder.Default
    @JsonProperty("skills")
    private List<String> skills = new ArrayList<>();

    @Builder.Default
    @JsonProperty("interests")
    private List<String> interests = new ArrayList<>();

    @Builder.Default
    @JsonProperty("life_goals")
    private List<String> lifeGoals = new ArrayList<>();

    @Builder.Default
    @JsonProperty("past_decisions")
    private List<String> pastDecisions = new ArrayList<>();

    @Builder.Default
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> attributes = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @JsonAnySetter
    public void setAttribute(String key, Object value) {
        attributes.put(key, value);
    }
}
