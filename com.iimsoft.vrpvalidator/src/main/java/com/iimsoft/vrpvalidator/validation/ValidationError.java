package com.iimsoft.vrpvalidator.validation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One finding of a rule checker.
 *
 * - code：稳定的错误码（E1xxx）
 * - message：具体原因，包含出问题的实体 id
 * - path：字段路径，例如 plan.jobs[3].pickups[0].times[1]
 * - references：涉及的实体 id（job id / vehicle type id / vehicle id）
 */
public final class ValidationError {

    private final ErrorCode code;
    private final String message;
    private final String path;
    private final List<String> references;

    public ValidationError(ErrorCode code, String message, String path, List<String> references) {
        this.code = Objects.requireNonNull(code, "code");
        this.message = Objects.requireNonNull(message, "message");
        this.path = path;
        this.references = references == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(references));
    }

    public static ValidationError of(ErrorCode code, String message, String path, String... references) {
        return new ValidationError(code, message, path, Arrays.asList(references));
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getAction() {
        return code.getAction();
    }

    public String getPath() {
        return path;
    }

    public List<String> getReferences() {
        return references;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationError)) return false;
        ValidationError that = (ValidationError) o;
        return code == that.code
                && message.equals(that.message)
                && Objects.equals(path, that.path)
                && references.equals(that.references);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, path, references);
    }

    @Override
    public String toString() {
        return code + " " + code.getTitle() + ": " + message + (path == null ? "" : " at " + path);
    }
}
