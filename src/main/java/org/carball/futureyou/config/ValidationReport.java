package org.carball.futureyou.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collected findings of an environment or input check. Only errors make it invalid.
 */
public class ValidationReport {

    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> info = new ArrayList<>();

    public boolean isValid() {
        return errors.isEmpty();
    }

    public ValidationReport error(String message) {
        errors.add(message);
        return this;
    }

    public ValidationReport warning(String message) {
        warnings.add(message);
        return this;
    }

    public ValidationReport info(String message) {
        info.add(message);
        return this;
    }

    public ValidationReport merge(ValidationReport other) {
        errors.addAll(other.errors);
        warnings.addAll(other.warnings);
        info.addAll(other.info);
        return this;
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<String> getInfo() {
        return Collections.unmodifiableList(info);
    }

    public String format() {
        StringBuilder sb = new StringBuilder();
        for (String line : info) {
            sb.append("  ✓ ").append(line).append("\n");
        }
        for (String line : warnings) {
            sb.append("  ⚠️  ").append(line).append("\n");
        }
        for (String line : errors) {
            sb.append("  ❌ ").append(line).append("\n");
        }
        sb.append(isValid() ? "\n✅ Validation passed" : "\n❌ Validation failed with " + errors.size() + " error(s)");
        return sb.toString();
    }
}
