package com.latchkey.backend.global.error;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;

/**
 * Field-level validation failure. Nothing has been written when this is thrown.
 */
public class ValidationProblemException extends ProblemException {

    public static final String CODE = "VALIDATION_FAILED";

    private final List<FieldViolation> violations;

    public ValidationProblemException(List<FieldViolation> violations) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, CODE, summarize(violations));
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("violations must not be empty");
        }
        this.violations = List.copyOf(violations);
    }

    public static ValidationProblemException of(String field, String message) {
        return new ValidationProblemException(List.of(new FieldViolation(field, message)));
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }

    public Map<String, List<String>> violationsByField() {
        return violations.stream()
                .collect(Collectors.groupingBy(
                        FieldViolation::field,
                        LinkedHashMap::new,
                        Collectors.mapping(FieldViolation::message, Collectors.toList())
                ));
    }

    private static String summarize(List<FieldViolation> violations) {
        if (violations == null) {
            return null;
        }
        return violations.stream()
                .map(violation -> violation.field() + ": " + violation.message())
                .collect(Collectors.joining("; "));
    }

    public record FieldViolation(String field, String message) {
    }
}
