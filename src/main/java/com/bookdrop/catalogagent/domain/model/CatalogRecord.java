package com.bookdrop.catalogagent.domain.model;

public record CatalogRecord(
        long id,
        String title,
        String author
) {
    public CatalogRecord {
        title = title == null ? "" : title;
        author = author == null ? "" : author;
    }
}
