package com.bookdrop.catalogagent.domain.model;

public record StrippedTitle(
        String title,
        String recoveredAuthor
) {
    public boolean isEmpty() {
        return title == null || title.isBlank();
    }
}
