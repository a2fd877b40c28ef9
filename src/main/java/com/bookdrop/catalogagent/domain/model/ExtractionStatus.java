package com.bookdrop.catalogagent.domain.model;

public enum ExtractionStatus {
    RESOLVED,
    TITLE_EMPTY,
    UNRESOLVED
}
