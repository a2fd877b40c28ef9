package com.bookdrop.catalogagent.domain.model;

import java.util.List;

public class ValidationResult {
    private final boolean valid;
    private final ProcessingStatus status;
    private final List<String> errors;

    private ValidationResult(boolean valid, ProcessingStatus status, List<String> errors) {
        this.valid = valid;
        this.status = status;
        this.errors = errors;
    }

    public static ValidationResult valid() {
        return new ValidationResult(true, ProcessingStatus.PROCESSING, List.of());
    }

    public static ValidationResult invalid(ProcessingStatus status, List<String> errors) {
        return new ValidationResult(false, status, errors);
    }

    public boolean isValid() {
        return valid;
    }

    public ProcessingStatus getStatus() {
        return status;
    }

    public List<String> getErrors() {
        return errors;
    }

    public String getErrorMessage() {
        return String.join("; ", errors);
    }
}
