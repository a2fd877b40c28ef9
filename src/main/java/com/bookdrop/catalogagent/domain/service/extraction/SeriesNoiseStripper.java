package com.bookdrop.catalogagent.domain.service.extraction;

import com.bookdrop.catalogagent.config.IngestConfig;
import com.bookdrop.catalogagent.domain.model.CatalogRecord;
import com.bookdrop.catalogagent.domain.model.CatalogSnapshot;
import com.bookdrop.catalogagent.domain.model.StrippedTitle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes series tags, download-site branding and trailing punctuation from a
 * file base name. A series tag that names a known catalog author is kept aside
 * as the recovered author.
 */
@Slf4j
@Component
public class SeriesNoiseStripper {

    private static final String BRACKET = "[\\[(][a-zA-Z0-9 -]+[\\])]";
    private static final Pattern BRACKET_GROUP = Pattern.compile(BRACKET);
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[(.]+$");

    // a run of tags together with the spaces around it; other spacing in the name is kept
    private static final Pattern BRACKET_RUN = withGaps(BRACKET, 0);

    private final List<Pattern> brandingPatterns;

    public SeriesNoiseStripper(IngestConfig config) {
        this.brandingPatterns = config.getExtraction().getBrandingMarkers().stream()
                .filter(marker -> marker != null && !marker.isBlank())
                .map(marker -> withGaps("\\(?" + Pattern.quote(marker.strip()) + "(?:\\.[a-zA-Z]{2,6})?\\)?",
                        Pattern.CASE_INSENSITIVE))
                .toList();
    }

    private static Pattern withGaps(String tag, int flags) {
        return Pattern.compile("\\s*(?:" + tag + "\\s*)+", flags);
    }

    public StrippedTitle strip(String text, CatalogSnapshot catalog) {
        if (text == null || text.isBlank()) {
            return new StrippedTitle("", "");
        }

        String current = text;
        String recoveredAuthor = "";

        // Removing one kind of noise can expose another, so repeat until nothing changes
        while (true) {
            if (recoveredAuthor.isEmpty()) {
                recoveredAuthor = authorFromBrackets(current, catalog);
            }
            String stripped = stripOnce(current);
            if (stripped.equals(current)) {
                break;
            }
            current = stripped;
        }

        if (!recoveredAuthor.isEmpty()) {
            log.debug("Recovered author '{}' from series tag in '{}'", recoveredAuthor, text);
        }
        return new StrippedTitle(current, recoveredAuthor);
    }

    private String authorFromBrackets(String text, CatalogSnapshot catalog) {
        Matcher matcher = BRACKET_GROUP.matcher(text);
        while (matcher.find()) {
            String content = matcher.group();
            content = content.substring(1, content.length() - 1).strip();
            if (content.isEmpty()) {
                continue;
            }
            String author = catalog.withAuthorMatching(content).stream()
                    .findFirst()
                    .map(CatalogRecord::author)
                    .orElse("");
            if (!author.isEmpty()) {
                return author;
            }
        }
        return "";
    }

    private String stripOnce(String text) {
        String result = BRACKET_RUN.matcher(text).replaceAll(" ");
        for (Pattern branding : brandingPatterns) {
            result = branding.matcher(result).replaceAll(" ");
        }
        result = result.strip();
        return TRAILING_PUNCTUATION.matcher(result).replaceAll("").strip();
    }
}
