package com.iimsoft.vrpvalidator.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered errors of one validation run. No errors means the definition passed every check.
 */
public final class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(Collections.emptyList());

    private final List<ValidationError> errors;

    public ValidationResult(List<ValidationError> errors) {
        this.errors = errors == null || errors.isEmpty()
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    public List<ValidationError> getErrors(ErrorCode code) {
        return errors.stream().filter(e -> e.getCode() == code).collect(Collectors.toList());
    }

    public List<ErrorCode> getCodes() {
        return errors.stream().map(ValidationError::getCode).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationResult)) return false;
        return errors.equals(((ValidationResult) o).errors);
    }

    @Override
    public int hashCode() {
        return errors.hashCode();
    }

    @Override
    public String toString() {
        return isValid() ? "valid" : errors.size() + " error(s): " + errors;
    }
}
