package com.bookdrop.catalogagent.domain.service.extraction;

import com.bookdrop.catalogagent.domain.model.CatalogSnapshot;
import com.bookdrop.catalogagent.domain.model.ExtractionResult;
import com.bookdrop.catalogagent.domain.model.StrippedTitle;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(3)
public class WholeTitleStrategy implements ExtractionStrategy {

    @Override
    public Optional<ExtractionResult> extract(StrippedTitle stripped, CatalogSnapshot catalog) {
        if (stripped.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ExtractionResult.resolved(stripped.title(), stripped.recoveredAuthor()));
    }
}
