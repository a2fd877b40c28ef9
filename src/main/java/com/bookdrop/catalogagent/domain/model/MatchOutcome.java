package com.bookdrop.catalogagent.domain.model;

public record MatchOutcome(
        Kind kind,
        long id,
        String title,
        String author
) {
    public enum Kind {
        EXISTING_ENTRY,
        NEW_TITLE,
        UNRESOLVABLE
    }

    public static final long UNASSIGNED = 0;

    public static MatchOutcome existingEntry(CatalogRecord record) {
        return new MatchOutcome(Kind.EXISTING_ENTRY, record.id(), record.title(), record.author());
    }

    public static MatchOutcome newTitle(String title, String author) {
        return new MatchOutcome(Kind.NEW_TITLE, UNASSIGNED, title, author);
    }

    public static MatchOutcome unresolvable() {
        return new MatchOutcome(Kind.UNRESOLVABLE, UNASSIGNED, "", "");
    }

    public boolean isExistingEntry() {
        return kind == Kind.EXISTING_ENTRY;
    }
}
