package com.bookdrop.catalogagent.domain.service.catalog;

import com.bookdrop.catalogagent.domain.model.CatalogRecord;
import com.bookdrop.catalogagent.domain.model.CatalogSnapshot;
import com.bookdrop.catalogagent.domain.port.CatalogListingSource;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Holds the catalog snapshot for the lifetime of the process. The snapshot is
 * read once at start-up; books added to the catalog afterwards are not seen.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogSnapshotService {

    private final CatalogListingSource listingSource;
    private final CatalogListingParser listingParser;
    private final BookFormatsParser formatsParser;

    private volatile CatalogSnapshot snapshot = CatalogSnapshot.empty();

    @PostConstruct
    public void load() {
        List<CatalogRecord> records = loadRecords();
        Map<Long, List<String>> formats = loadFormats();
        snapshot = new CatalogSnapshot(records, formats);
        log.info("Catalog snapshot ready: {} books, {} with known formats", records.size(), formats.size());
    }

    public CatalogSnapshot getSnapshot() {
        return snapshot;
    }

    private List<CatalogRecord> loadRecords() {
        try {
            return listingParser.parse(listingSource.readBookListing());
        } catch (IOException ex) {
            log.error("Failed to read catalog listing, every book will be treated as new: {}", ex.getMessage(), ex);
            return List.of();
        }
    }

    private Map<Long, List<String>> loadFormats() {
        try {
            return formatsParser.parse(listingSource.readFormatsListing());
        } catch (IOException ex) {
            log.error("Failed to read catalog formats listing: {}", ex.getMessage(), ex);
            return Map.of();
        }
    }
}
