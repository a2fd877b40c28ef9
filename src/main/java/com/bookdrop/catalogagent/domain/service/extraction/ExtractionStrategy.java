package com.bookdrop.catalogagent.domain.service.extraction;

import com.bookdrop.catalogagent.domain.model.CatalogSnapshot;
import com.bookdrop.catalogagent.domain.model.ExtractionResult;
import com.bookdrop.catalogagent.domain.model.StrippedTitle;

import java.util.Optional;

/**
 * One way of splitting a cleaned file base name into title and author.
 * Strategies are tried in {@link org.springframework.core.annotation.Order} order;
 * the first one returning a result wins.
 */
public interface ExtractionStrategy {

    Optional<ExtractionResult> extract(StrippedTitle stripped, CatalogSnapshot catalog);
}
