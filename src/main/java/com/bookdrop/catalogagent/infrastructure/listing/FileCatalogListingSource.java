package com.bookdrop.catalogagent.infrastructure.listing;

import com.bookdrop.catalogagent.config.IngestConfig;
import com.bookdrop.catalogagent.domain.port.CatalogListingSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Reads listings saved to disk, e.g. {@code calibredb list > books.txt}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileCatalogListingSource implements CatalogListingSource {

    private final IngestConfig config;

    @Override
    public List<String> readBookListing() throws IOException {
        return readLines(config.getCatalog().getListingFile(), "book listing");
    }

    @Override
    public List<String> readFormatsListing() throws IOException {
        return readLines(config.getCatalog().getFormatsListingFile(), "formats listing");
    }

    private List<String> readLines(String location, String description) throws IOException {
        if (location == null || location.isBlank()) {
            log.info("No {} file configured", description);
            return List.of();
        }

        Path path = Paths.get(location);
        if (!Files.isRegularFile(path)) {
            throw new IOException("Catalog " + description + " file not found: " + path.toAbsolutePath());
        }

        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        log.info("Read {} lines of {} from {}", lines.size(), description, path);
        return lines;
    }
}
