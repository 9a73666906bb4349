package org.carball.futureyou.validation;

import org.carball.futureyou.model.UserProfile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape and range checks for caller-supplied profile, decision and timeline data.
 * All checks run before the pipeline touches the model.
 */
public final class InputValidator {

    public static final List<String> VALID_TIMELINES = List.of("1yr", "3yr", "5yr");
    public static final List<String> REQUIRED_PROFILE_FIELDS = List.of("user_id", "age", "current_role");
    public static final List<String> LIST_PROFILE_FIELDS = List.of("skills", "interests", "life_goals", "past_decisions");

    public static final int MIN_AGE = 16;
    public static final int MAX_AGE = 100;
    public static final int MIN_DECISION_LENGTH = 10;

    private static final String AGE_MESSAGE = "Age must be an integer between " + MIN_AGE + " and " + MAX_AGE;

    private InputValidator() {
    }

    /**
     * Validates raw profile data and returns a copy in which absent list fields are empty lists.
     * The argument is never modified, so immutable maps are accepted.
     */
    public static Map<String, Object> validateProfile(Map<String, Object> data) {
        if (data == null) {
            throw new ValidationException("User profile is required");
        }

        for (String field : REQUIRED_PROFILE_FIELDS) {
            if (data.get(field) == null) {
                throw new ValidationException("Missing required field: " + field);
            }
        }
        requireNotBlank(data.get("user_id").toString(), "user_id");
        requireNotBlank(data.get("current_role").toString(), "current_role");

        Object age = data.get("age");
        if (!isWholeNumber(age)) {
            throw new ValidationException(AGE_MESSAGE);
        }
        checkAgeRange(((Number) age).longValue());

        Map<String, Object> validated = new LinkedHashMap<>(data);
        for (String field : LIST_PROFILE_FIELDS) {
            if (!validated.containsKey(field)) {
                validated.put(field, new ArrayList<>());
            } else if (!(validated.get(field) instanceof List)) {
                throw new ValidationException(field + " must be a list");
            }
        }
        return validated;
    }

    /**
     * Typed variant of {@link #validateProfile(Map)}. Null lists are replaced with empty ones.
     */
    public static UserProfile validateProfile(UserProfile profile) {
        if (profile == null) {
            throw new ValidationException("User profile is required");
        }
        if (profile.getUserId() == null) {
            throw new ValidationException("Missing required field: user_id");
        }
        if (profile.getAge() == null) {
            throw new ValidationException("Missing required field: age");
        }
        if (profile.getCurrentRole() == null) {
            throw new ValidationException("Missing required field: current_role");
        }
        requireNotBlank(profile.getUserId(), "user_id");
        requireNotBlank(profile.getCurrentRole(), "current_role");
        checkAgeRange(profile.getAge());

        if (profile.getSkills() == null) {
            profile.setSkills(new ArrayList<>());
        }
        if (profile.getInterests() == null) {
            profile.setInterests(new ArrayList<>());
        }
        if (profile.getLifeGoals() == null) {
            profile.setLifeGoals(new ArrayList<>());
        }
        if (profile.getPastDecisions() == null) {
            profile.setPastDecisions(new ArrayList<>());
        }
        return profile;
    }

    /**
     * Returns the trimmed decision text.
     */
    public static String validateDecision(String decision) {
        if (decision == null || decision.isEmpty()) {
            throw new ValidationException("Decision must be a non-empty string");
        }
        String trimmed = decision.trim();
        if (trimmed.length() < MIN_DECISION_LENGTH) {
            throw new ValidationException("Decision must be at least " + MIN_DECISION_LENGTH + " characters long");
        }
        return trimmed;
    }

    public static List<String> validateTimelines(List<String> timelines) {
        if (timelines == null || timelines.isEmpty()) {
            throw new ValidationException("Timelines must be a non-empty list");
        }
        for (String timeline : timelines) {
            validateTimeline(timeline);
        }
        return timelines;
    }

    public static String validateTimeline(String timeline) {
        if (!VALID_TIMELINES.contains(timeline)) {
            throw new ValidationException("Invalid timeline: " + timeline + ". Must be one of " + VALID_TIMELINES);
        }
        return timeline;
    }

    private static void checkAgeRange(long age) {
        if (age < MIN_AGE || age > MAX_AGE) {
            throw new ValidationException(AGE_MESSAGE);
        }
    }

    private static boolean isWholeNumber(Object value) {
        return value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte;
    }

    private static void requireNotBlank(String value, String field) {
        if (value.trim().isEmpty()) {
            throw new ValidationException(field + " must not be empty");
        }
    }
}
