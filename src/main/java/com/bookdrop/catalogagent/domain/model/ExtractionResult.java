package com.bookdrop.catalogagent.domain.model;

/**
 * Best (title, author) guess recovered from a file name.
 * <p>
 * {@code catalogId} carries the id of a record the extractor already hit directly,
 * or {@link #NOT_FOUND} when the guess still has to be resolved against the catalog.
 */
public record ExtractionResult(
        String title,
        String author,
        ExtractionStatus status,
        long catalogId
) {
    public static final long NOT_FOUND = -1;

    public ExtractionResult {
        title = title == null ? "" : title.trim();
        author = author == null ? "" : author.trim();
        if (status == ExtractionStatus.RESOLVED && title.isEmpty()) {
            throw new IllegalArgumentException("Resolved extraction requires a title");
        }
    }

    public static ExtractionResult resolved(String title, String author) {
        return new ExtractionResult(title, author, ExtractionStatus.RESOLVED, NOT_FOUND);
    }

    public static ExtractionResult catalogHit(CatalogRecord record) {
        return new ExtractionResult(record.title(), record.author(), ExtractionStatus.RESOLVED, record.id());
    }

    public static ExtractionResult titleEmpty() {
        return new ExtractionResult("", "", ExtractionStatus.TITLE_EMPTY, NOT_FOUND);
    }

    public boolean isCatalogHit() {
        return catalogId != NOT_FOUND;
    }
}
