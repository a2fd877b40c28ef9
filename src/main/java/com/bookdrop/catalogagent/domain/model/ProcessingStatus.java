package com.bookdrop.catalogagent.domain.model;

public enum ProcessingStatus {
    PROCESSING("Processing file '%s' ..."),
    NO_EXTENSION("Received file '%s', cannot process a file without extension"),
    UNSUPPORTED_FORMAT("Format of '%s' is not supported"),
    CANNOT_EXTRACT_TITLE("Unable to extract book title from the received file name '%s'"),
    TITLE_EMPTY("Book title not found in file '%s'"),
    BOOK_NOT_FOUND("'%s' is not in the catalog yet"),
    BOOK_FOUND("'%s' is already in the catalog"),
    FAILED("Unexpected error for '%s'");

    private final String template;

    ProcessingStatus(String template) {
        this.template = template;
    }

    public String describe(String fileName) {
        return String.format(template, fileName);
    }
}
