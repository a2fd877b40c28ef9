package com.bookdrop.catalogagent.domain.service.catalog;

import com.bookdrop.catalogagent.domain.model.CatalogRecord;
import com.bookdrop.catalogagent.domain.model.CatalogSnapshot;
import com.bookdrop.catalogagent.domain.model.ExtractionResult;
import com.bookdrop.catalogagent.domain.model.ExtractionStatus;
import com.bookdrop.catalogagent.domain.model.MatchOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import static com.bookdrop.catalogagent.domain.service.catalog.FuzzySetMatcher.AUTHOR_SEPARATORS;
import static com.bookdrop.catalogagent.domain.service.catalog.FuzzySetMatcher.TITLE_SEPARATORS;
import static com.bookdrop.catalogagent.domain.service.catalog.FuzzySetMatcher.isSubsetEitherWay;
import static com.bookdrop.catalogagent.domain.service.catalog.FuzzySetMatcher.tokens;

/**
 * Decides whether an extracted (title, author) guess is a book already in the
 * catalog. The first record in listing order that agrees wins.
 */
@Slf4j
@Service
public class CatalogResolver {

    private static final Pattern TITLE_PUNCTUATION = Pattern.compile("[:_-]+");

    public MatchOutcome resolve(ExtractionResult extraction, CatalogSnapshot catalog) {
        if (extraction == null || extraction.status() != ExtractionStatus.RESOLVED) {
            return MatchOutcome.unresolvable();
        }

        if (extraction.isCatalogHit()) {
            Optional<CatalogRecord> hit = catalog.findById(extraction.catalogId())
                    .filter(record -> record.id() > 0);
            if (hit.isPresent()) {
                log.debug("Extraction already points at catalog id {}", extraction.catalogId());
                return MatchOutcome.existingEntry(hit.get());
            }
        }

        for (CatalogRecord record : catalog.records()) {
            if (record.id() <= 0 || record.title().isBlank()) {
                continue;
            }
            if (agrees(extraction, record)) {
                log.debug("'{}' by '{}' resolved to catalog id {}", extraction.title(), extraction.author(), record.id());
                return MatchOutcome.existingEntry(record);
            }
        }

        log.debug("'{}' by '{}' not found in catalog", extraction.title(), extraction.author());
        return MatchOutcome.newTitle(extraction.title(), extraction.author());
    }

    private boolean agrees(ExtractionResult extraction, CatalogRecord record) {
        String title = withoutPunctuation(extraction.title());
        String recordTitle = withoutPunctuation(record.title());

        Set<String> titleWords = tokens(title, TITLE_SEPARATORS);
        Set<String> recordTitleWords = tokens(recordTitle, TITLE_SEPARATORS);

        // literal, case-sensitive containment; the word sets below ignore case
        boolean titleAgrees = (!title.isBlank() && recordTitle.contains(title))
                || (!titleWords.isEmpty() && isSubsetEitherWay(titleWords, recordTitleWords));
        if (!titleAgrees) {
            return false;
        }

        if (extraction.author().isEmpty()) {
            return true;
        }

        Set<String> authorWords = tokens(extraction.author(), AUTHOR_SEPARATORS);
        Set<String> recordAuthorWords = tokens(record.author(), AUTHOR_SEPARATORS);

        return recordAuthorWords.containsAll(authorWords)
                || recordTitleWords.containsAll(authorWords)
                || (!recordAuthorWords.isEmpty() && titleWords.containsAll(recordAuthorWords));
    }

    private String withoutPunctuation(String text) {
        return TITLE_PUNCTUATION.matcher(text).replaceAll("").strip();
    }
}
