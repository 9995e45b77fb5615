package com.delta.propertytracker.crawl.validation;

import java.util.List;

public record ValidationResult(int score, List<String> issues, boolean valid) {
    public static final int MAX_SCORE = 20;
    public static final int VALID_THRESHOLD = 10;

    public ValidationResult {
        issues = List.copyOf(issues);
    }

    public static ValidationResult of(int score, List<String> issues) {
        return new ValidationResult(score, issues, score >= VALID_THRESHOLD);
    }

    public double completenessPercentage() {
        return score * 100.0 / MAX_SCORE;
    }
}
