package com.bookdrop.catalogagent.domain.port;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the raw text the catalog tool printed for its listing commands.
 */
public interface CatalogListingSource {

    List<String> readBookListing() throws IOException;

    List<String> readFormatsListing() throws IOException;
}
