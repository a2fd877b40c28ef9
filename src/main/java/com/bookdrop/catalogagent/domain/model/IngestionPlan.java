package com.bookdrop.catalogagent.domain.model;

public record IngestionPlan(
        String fileName,
        ProcessingStatus status,
        IngestionAction action,
        MatchOutcome outcome,
        ConversionDecision conversion,
        String message
) {
    public static IngestionPlan skipped(String fileName, ProcessingStatus status, String message) {
        return new IngestionPlan(fileName, status, IngestionAction.SKIP, MatchOutcome.unresolvable(),
                ConversionDecision.notApplicable(), message);
    }
}
