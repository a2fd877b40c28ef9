package com.bookdrop.catalogagent.messaging.producer.dto;

import com.bookdrop.catalogagent.domain.model.IngestionPlan;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

@JsonTypeName("ingest_result")
public record IngestionResultDto(
        String requestId,
        List<IngestionPlan> plans,
        boolean success,
        String message,
        List<String> errors
) {
}
