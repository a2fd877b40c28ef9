package com.bookdrop.catalogagent.domain.service;

import com.bookdrop.catalogagent.domain.model.BookFileName;
import com.bookdrop.catalogagent.domain.model.CatalogSnapshot;
import com.bookdrop.catalogagent.domain.model.ConversionDecision;
import com.bookdrop.catalogagent.domain.model.ExtractionResult;
import com.bookdrop.catalogagent.domain.model.ExtractionStatus;
import com.bookdrop.catalogagent.domain.model.IngestionAction;
import com.bookdrop.catalogagent.domain.model.IngestionPlan;
import com.bookdrop.catalogagent.domain.model.MatchOutcome;
import com.bookdrop.catalogagent.domain.model.ProcessingStatus;
import com.bookdrop.catalogagent.domain.model.ValidationResult;
import com.bookdrop.catalogagent.domain.service.catalog.CatalogResolver;
import com.bookdrop.catalogagent.domain.service.catalog.CatalogSnapshotService;
import com.bookdrop.catalogagent.domain.service.extraction.TitleAuthorExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Works out what should happen to each dropped book file: add it as a new
 * catalog entry, attach it to an existing one, or skip it. Nothing here touches
 * the file system or the catalog; the caller carries out the plan.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookIngestionService {

    private final CatalogSnapshotService snapshotService;
    private final FileNameParser fileNameParser;
    private final BookFileValidator fileValidator;
    private final TitleAuthorExtractor extractor;
    private final CatalogResolver resolver;
    private final ConversionPlanner conversionPlanner;

    public List<IngestionPlan> planBatch(List<String> fileNames) {
        log.info("Planning ingestion of {} files", fileNames.size());

        List<IngestionPlan> plans = new ArrayList<>();
        for (String fileName : fileNames) {
            try {
                plans.add(plan(fileName));
            } catch (Exception ex) {
                log.error("Error planning ingestion of '{}': {}", fileName, ex.getMessage(), ex);
                plans.add(IngestionPlan.skipped(fileName, ProcessingStatus.FAILED,
                        ProcessingStatus.FAILED.describe(fileName) + ": " + ex.getMessage()));
            }
        }

        long actionable = plans.stream().filter(plan -> plan.action() != IngestionAction.SKIP).count();
        log.info("Ingestion planning completed: {} of {} files actionable", actionable, plans.size());
        return plans;
    }

    public IngestionPlan plan(String fileName) {
        CatalogSnapshot catalog = snapshotService.getSnapshot();
        BookFileName file = fileNameParser.parse(fileName);
        log.info("Processing file '{}'", file.fileName());

        ValidationResult validation = fileValidator.validate(file);
        if (!validation.isValid()) {
            return IngestionPlan.skipped(fileName, validation.getStatus(), validation.getErrorMessage());
        }

        ExtractionResult extraction = extractor.extract(file.baseName(), catalog);
        if (extraction.status() != ExtractionStatus.RESOLVED) {
            ProcessingStatus status = extraction.status() == ExtractionStatus.TITLE_EMPTY
                    ? ProcessingStatus.TITLE_EMPTY
                    : ProcessingStatus.CANNOT_EXTRACT_TITLE;
            log.warn("Cannot extract a title from '{}' ({})", fileName, status);
            return IngestionPlan.skipped(fileName, status, status.describe(fileName));
        }

        MatchOutcome outcome = resolver.resolve(extraction, catalog);
        if (outcome.kind() == MatchOutcome.Kind.UNRESOLVABLE) {
            return IngestionPlan.skipped(fileName, ProcessingStatus.CANNOT_EXTRACT_TITLE,
                    ProcessingStatus.CANNOT_EXTRACT_TITLE.describe(fileName));
        }

        if (outcome.isExistingEntry()) {
            ConversionDecision conversion = conversionPlanner.plan(file, catalog.formatsOf(outcome.id()));
            log.info("'{}' is catalog book {} '{}' by '{}', conversion: {}",
                    fileName, outcome.id(), outcome.title(), outcome.author(), conversion.verdict());
            return new IngestionPlan(fileName, ProcessingStatus.BOOK_FOUND, IngestionAction.REUSE_EXISTING,
                    outcome, conversion, describe(fileName, outcome, conversion));
        }

        ConversionDecision conversion = conversionPlanner.plan(file, List.of());
        log.info("'{}' is a new book '{}' by '{}', conversion: {}",
                fileName, outcome.title(), outcome.author(), conversion.verdict());
        return new IngestionPlan(fileName, ProcessingStatus.BOOK_NOT_FOUND, IngestionAction.ADD_NEW_ENTRY,
                outcome, conversion, describe(fileName, outcome, conversion));
    }

    private String describe(String fileName, MatchOutcome outcome, ConversionDecision conversion) {
        String book = outcome.isExistingEntry()
                ? "'" + fileName + "' matches catalog book " + outcome.id() + " '" + outcome.title() + "'"
                : "'" + fileName + "' is a new book '" + outcome.title() + "'";

        return switch (conversion.verdict()) {
            case CONVERT -> book + ", converting to " + conversion.targetFormat();
            case FORMAT_IN_DB -> book + ", already in the catalog as " + conversion.targetFormat();
            case ABANDONED_PDF -> book + ", PDF file, please try manual conversion";
            case NOT_APPLICABLE -> book;
        };
    }
}
