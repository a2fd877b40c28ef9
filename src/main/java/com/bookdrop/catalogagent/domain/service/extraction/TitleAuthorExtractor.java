package com.bookdrop.catalogagent.domain.service.extraction;

import com.bookdrop.catalogagent.domain.model.CatalogSnapshot;
import com.bookdrop.catalogagent.domain.model.ExtractionResult;
import com.bookdrop.catalogagent.domain.model.ExtractionStatus;
import com.bookdrop.catalogagent.domain.model.StrippedTitle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class TitleAuthorExtractor {

    private static final Pattern TRAILING_PARENTHETICAL = Pattern.compile("\\([^()]*\\)\\s*$");

    private final SeriesNoiseStripper stripper;
    private final List<ExtractionStrategy> strategies;

    public ExtractionResult extract(String baseName, CatalogSnapshot catalog) {
        StrippedTitle stripped = stripper.strip(baseName, catalog);
        if (stripped.isEmpty()) {
            log.info("Nothing left of '{}' after removing series and site tags", baseName);
            return ExtractionResult.titleEmpty();
        }

        for (ExtractionStrategy strategy : strategies) {
            Optional<ExtractionResult> result = strategy.extract(stripped, catalog);
            if (result.isPresent()) {
                log.debug("{} extracted {} from '{}'", strategy.getClass().getSimpleName(), result.get(), baseName);
                return cleanUp(result.get());
            }
        }

        log.warn("No extraction strategy applied to '{}'", baseName);
        return new ExtractionResult(stripped.title(), stripped.recoveredAuthor(),
                ExtractionStatus.UNRESOLVED, ExtractionResult.NOT_FOUND);
    }

    private ExtractionResult cleanUp(ExtractionResult result) {
        if (result.isCatalogHit()) {
            return result;
        }
        String title = TRAILING_PARENTHETICAL.matcher(result.title()).replaceAll("").strip();
        if (title.isEmpty()) {
            return ExtractionResult.titleEmpty();
        }
        return ExtractionResult.resolved(title, result.author());
    }
}
