package com.bookdrop.catalogagent.domain.service;

import com.bookdrop.catalogagent.config.IngestConfig;
import com.bookdrop.catalogagent.domain.model.BookFileName;
import com.bookdrop.catalogagent.domain.model.ProcessingStatus;
import com.bookdrop.catalogagent.domain.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class BookFileValidator {

    private final IngestConfig config;

    public ValidationResult validate(BookFileName file) {
        if (!file.hasExtension()) {
            log.warn("Received file '{}' without extension", file.fileName());
            return ValidationResult.invalid(ProcessingStatus.NO_EXTENSION,
                    List.of(ProcessingStatus.NO_EXTENSION.describe(file.fileName())));
        }

        boolean supported = config.getSupportedExtensions().stream()
                .anyMatch(ext -> ext.equalsIgnoreCase(file.extension()));
        if (!supported) {
            log.warn("Skipping non-book file: {}", file.fileName());
            return ValidationResult.invalid(ProcessingStatus.UNSUPPORTED_FORMAT,
                    List.of(ProcessingStatus.UNSUPPORTED_FORMAT.describe(file.fileName())));
        }

        return ValidationResult.valid();
    }
}
