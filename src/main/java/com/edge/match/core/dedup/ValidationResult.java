package com.edge.match.core.dedup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 校验结果，只作为数据返回，由调用方决定如何处理
 */
public class ValidationResult {
    private final List<ValidationIssue> warnings;
    private final List<ValidationIssue> errors;

    public ValidationResult(List<ValidationIssue> warnings, List<ValidationIssue> errors) {
        this.warnings = warnings;
        this.errors = errors;
    }

    public static ValidationResult union(ValidationResult... results) {
        List<ValidationIssue> warnings = new ArrayList<>();
        List<ValidationIssue> errors = new ArrayList<>();
        for (ValidationResult result : results) {
            warnings.addAll(result.getWarnings());
            errors.addAll(result.getErrors());
        }
        return new ValidationResult(warnings, errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationIssue> getWarnings() { return warnings; }
    public List<ValidationIssue> getErrors() { return errors; }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Validation ").append(isValid() ? "PASSED" : "FAILED").append('\n');
        sb.append("  Errors: ").append(errors.size()).append('\n');
        sb.append("  Warnings: ").append(warnings.size());

        if (!errors.isEmpty()) {
            sb.append("\n\nErrors:");
            for (ValidationIssue error : errors) {
                sb.append("\n  ").append(error);
            }
        }
        if (!warnings.isEmpty()) {
            sb.append("\n\nWarnings:");
            Map<ValidationIssue.Category, Integer> byCategory = new LinkedHashMap<>();
            for (ValidationIssue warning : warnings) {
                byCategory.merge(warning.getCategory(), 1, Integer::sum);
            }
            byCategory.forEach((category, count) ->
                    sb.append("\n  ").append(category.name().toLowerCase()).append(": ").append(count));
        }
        return sb.toString();
    }
}
