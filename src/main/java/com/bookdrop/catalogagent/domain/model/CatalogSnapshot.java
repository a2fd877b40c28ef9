package com.bookdrop.catalogagent.domain.model;

import com.bookdrop.catalogagent.domain.service.catalog.FuzzySetMatcher;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the catalog taken once per run.
 * Records keep the order in which the listing emitted them.
 */
public record CatalogSnapshot(
        List<CatalogRecord> records,
        Map<Long, List<String>> formats
) {
    public CatalogSnapshot {
        records = records == null ? List.of() : List.copyOf(records);
        formats = formats == null ? Map.of() : Map.copyOf(formats);
    }

    public static CatalogSnapshot of(List<CatalogRecord> records) {
        return new CatalogSnapshot(records, Map.of());
    }

    public static CatalogSnapshot empty() {
        return new CatalogSnapshot(List.of(), Map.of());
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }

    public Optional<CatalogRecord> findById(long id) {
        return records.stream()
                .filter(record -> record.id() == id)
                .findFirst();
    }

    public List<String> formatsOf(long id) {
        return formats.getOrDefault(id, List.of());
    }

    /** True if the text fuzzy-matches the title of any record. */
    public boolean isTitle(String text) {
        return records.stream().anyMatch(record -> FuzzySetMatcher.matchesNonBlank(text, record.title()));
    }

    /** True if the text fuzzy-matches the author of any record. */
    public boolean isAuthor(String text) {
        return records.stream().anyMatch(record -> FuzzySetMatcher.matchesNonBlank(text, record.author()));
    }

    public List<CatalogRecord> withTitleMatching(String text) {
        return records.stream()
                .filter(record -> FuzzySetMatcher.matchesNonBlank(text, record.title()))
                .toList();
    }

    public List<CatalogRecord> withAuthorMatching(String text) {
        return records.stream()
                .filter(record -> FuzzySetMatcher.matchesNonBlank(text, record.author()))
                .toList();
    }
}
