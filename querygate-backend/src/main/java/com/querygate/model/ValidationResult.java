package com.querygate.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {
    boolean ok;
    String reason;
    String sanitizedText;

    public static ValidationResult ok(String sanitizedText) {
        return new ValidationResult(true, null, sanitizedText);
    }

    public static ValidationResult rejected(String reason) {
        return new ValidationResult(false, reason, null);
    }
}
