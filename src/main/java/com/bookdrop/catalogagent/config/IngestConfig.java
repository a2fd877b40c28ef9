package com.bookdrop.catalogagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "ingest")
public class IngestConfig {

    private List<String> supportedExtensions = new ArrayList<>(List.of(
            "epub", "mobi", "azw3", "pdf", "fb2", "txt", "djvu"
    ));
    private Catalog catalog = new Catalog();
    private Extraction extraction = new Extraction();
    private Conversion conversion = new Conversion();

    @Data
    public static class Catalog {
        private String listingFile;
        private String formatsListingFile;
    }

    @Data
    public static class Extraction {
        private List<String> brandingMarkers = new ArrayList<>(List.of("z-lib"));
        private int maxHyphenSplits = 3;
    }

    @Data
    public static class Conversion {
        private String targetFormat = "mobi";
    }
}
