package com.bookdrop.catalogagent.messaging.consumer.dto;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

@JsonTypeName("ingest_books")
public record IngestBooksTaskDto(
        String requestId,
        List<String> fileNames
) {
}
