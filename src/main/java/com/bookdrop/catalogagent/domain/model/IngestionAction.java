package com.bookdrop.catalogagent.domain.model;

public enum IngestionAction {
    ADD_NEW_ENTRY,
    REUSE_EXISTING,
    SKIP
}
