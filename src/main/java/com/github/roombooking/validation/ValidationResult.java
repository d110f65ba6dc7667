package com.github.roombooking.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a validation pass: blocking errors plus advisory warnings.
 *
 * @param errors rule violations; the input is valid only if this is empty
 * @param warnings advisory messages that never block a booking
 */
public record ValidationResult(List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult valid() {
        return new ValidationResult(List.of(), List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Returns errors followed by warnings, for display.
     *
     * @return all messages in one list
     */
    public List<String> messages() {
        List<String> all = new ArrayList<>(errors.size() + warnings.size());
        all.addAll(errors);
        all.addAll(warnings);
        return List.copyOf(all);
    }
}
