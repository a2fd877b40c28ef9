package com.bookdrop.catalogagent.domain.service.extraction;

import com.bookdrop.catalogagent.config.IngestConfig;
import com.bookdrop.catalogagent.domain.model.CatalogRecord;
import com.bookdrop.catalogagent.domain.model.CatalogSnapshot;
import com.bookdrop.catalogagent.domain.model.ExtractionResult;
import com.bookdrop.catalogagent.domain.model.StrippedTitle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

import static com.bookdrop.catalogagent.domain.service.catalog.FuzzySetMatcher.matchesNonBlank;

/**
 * "Author - Title" or "Title - Author".
 * <p>
 * The right-hand side is taken as the title unless the catalog knows it as an
 * author and not as a title. The guess is then cross-checked against the catalog.
 * When the first " - " gives no catalog hit, later occurrences are tried as split
 * points, up to {@code ingest.extraction.max-hyphen-splits} in total; a later split
 * is only used if it hits a catalog record.
 */
@Slf4j
@Component
@Order(2)
public class HyphenSplitStrategy implements ExtractionStrategy {

    private static final String SEPARATOR = " - ";
    private static final Pattern LEADING_HYPHENS = Pattern.compile("^[-\\s]+");

    private final int maxSplits;

    public HyphenSplitStrategy(IngestConfig config) {
        this.maxSplits = Math.max(1, config.getExtraction().getMaxHyphenSplits());
    }

    @Override
    public Optional<ExtractionResult> extract(StrippedTitle stripped, CatalogSnapshot catalog) {
        String text = stripped.title();
        int index = text.indexOf(SEPARATOR);
        if (index < 0) {
            return Optional.empty();
        }

        Split direct = split(text, index, catalog);
        Optional<ExtractionResult> hit = direct.catalogHit(catalog);
        if (hit.isEmpty()) {
            hit = resplit(text, index, 2, catalog);
        }
        if (hit.isPresent()) {
            return hit;
        }

        String title = direct.title().isEmpty() ? text : direct.title();
        String author = direct.author().isEmpty() ? stripped.recoveredAuthor() : direct.author();
        log.debug("No catalog hit for '{}', using title='{}', author='{}'", text, title, author);
        return Optional.of(ExtractionResult.resolved(title, author));
    }

    private Optional<ExtractionResult> resplit(String text, int previousIndex, int attempt, CatalogSnapshot catalog) {
        if (attempt > maxSplits) {
            return Optional.empty();
        }
        int index = text.indexOf(SEPARATOR, previousIndex + SEPARATOR.length());
        if (index < 0) {
            return Optional.empty();
        }

        Optional<ExtractionResult> hit = split(text, index, catalog).catalogHit(catalog);
        if (hit.isPresent()) {
            log.debug("Split #{} of '{}' hit catalog id {}", attempt, text, hit.get().catalogId());
            return hit;
        }
        return resplit(text, index, attempt + 1, catalog);
    }

    private Split split(String text, int index, CatalogSnapshot catalog) {
        String before = text.substring(0, index).strip();
        String after = LEADING_HYPHENS.matcher(text.substring(index + SEPARATOR.length())).replaceAll("").strip();

        boolean titleAfter = catalog.isTitle(after) || !catalog.isAuthor(after);
        return titleAfter ? new Split(after, before) : new Split(before, after);
    }

    private record Split(String title, String author) {

        Optional<ExtractionResult> catalogHit(CatalogSnapshot catalog) {
            if (title.isEmpty()) {
                return Optional.empty();
            }

            for (CatalogRecord record : catalog.withTitleMatching(title)) {
                if (matchesNonBlank(author, record.author())) {
                    return Optional.of(ExtractionResult.catalogHit(record));
                }
            }

            // The split may have put the author where the title was expected
            for (CatalogRecord record : catalog.withAuthorMatching(title)) {
                if (matchesNonBlank(author, record.title())) {
                    return Optional.of(ExtractionResult.catalogHit(record));
                }
            }
            return Optional.empty();
        }
    }
}
