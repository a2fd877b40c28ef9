package com.bookdrop.catalogagent.domain.service.extraction;

import com.bookdrop.catalogagent.domain.model.CatalogSnapshot;
import com.bookdrop.catalogagent.domain.model.ExtractionResult;
import com.bookdrop.catalogagent.domain.model.StrippedTitle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * "Title by Author". Splits at the last " by " so titles containing the word keep it.
 */
@Slf4j
@Component
@Order(1)
public class ByAuthorStrategy implements ExtractionStrategy {

    private static final String SEPARATOR = " by ";

    @Override
    public Optional<ExtractionResult> extract(StrippedTitle stripped, CatalogSnapshot catalog) {
        String text = stripped.title();
        int index = text.lastIndexOf(SEPARATOR);
        if (index < 0) {
            return Optional.empty();
        }

        String title = text.substring(0, index).strip();
        String author = text.substring(index + SEPARATOR.length()).strip();
        if (title.isEmpty()) {
            return Optional.empty();
        }

        log.debug("Split '{}' at ' by ': title='{}', author='{}'", text, title, author);
        return Optional.of(ExtractionResult.resolved(title, author));
    }
}
