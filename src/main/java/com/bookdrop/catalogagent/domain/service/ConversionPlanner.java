package com.bookdrop.catalogagent.domain.service;

import com.bookdrop.catalogagent.config.IngestConfig;
import com.bookdrop.catalogagent.domain.model.BookFileName;
import com.bookdrop.catalogagent.domain.model.ConversionDecision;
import com.bookdrop.catalogagent.domain.model.ConversionDecision.Verdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Decides whether a dropped book still needs converting to the target format.
 * PDFs are never converted automatically.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversionPlanner {

    private final IngestConfig config;

    public ConversionDecision plan(BookFileName file, List<String> existingFormats) {
        String target = config.getConversion().getTargetFormat();

        if ("pdf".equalsIgnoreCase(file.extension())) {
            return ConversionDecision.of(Verdict.ABANDONED_PDF, target);
        }

        boolean present = target.equalsIgnoreCase(file.extension())
                || existingFormats.stream().anyMatch(target::equalsIgnoreCase);
        if (present) {
            log.debug("'{}' already available as {}", file.fileName(), target);
            return ConversionDecision.of(Verdict.FORMAT_IN_DB, target);
        }

        return ConversionDecision.convert(target, file.baseName() + "." + target);
    }
}
