package com.bookdrop.catalogagent.domain.service.catalog;

import com.bookdrop.catalogagent.domain.model.CatalogRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the tabular output of {@code calibredb list} into catalog records.
 * <p>
 * A row starts with the numeric id followed by the title and author columns,
 * separated by at least two spaces. Long titles wrap: the following physical
 * lines carry no id and continue the title (and possibly the author) of the
 * previous row. When the listing starts with its {@code id  title  authors}
 * header, a wrapped fragment is placed by the column it starts in, so a line
 * that only continues the author list lands in the author.
 */
@Slf4j
@Service
public class CatalogListingParser {

    private static final Pattern IGNORED_LINE = Pattern.compile("^(Fail|id +title|id +formats)");
    private static final Pattern HEADER = Pattern.compile("^id +title +(authors)");
    private static final Pattern FRAGMENT = Pattern.compile("[^ ]+(?: [^ ]+)*");
    private static final Pattern RECORD_ID = Pattern.compile("^(\\d+) +");
    private static final Pattern COLUMN_GAP = Pattern.compile(" {2,}");
    private static final Pattern WORD_ENDING = Pattern.compile("[\\w;,&]+$");
    private static final Pattern JOINING_ENDING = Pattern.compile("[-/]+$");

    public List<CatalogRecord> parse(String listing) {
        if (listing == null || listing.isEmpty()) {
            return List.of();
        }
        return parse(Arrays.asList(listing.split("\\R")));
    }

    public List<CatalogRecord> parse(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return List.of();
        }

        List<RecordBuilder> builders = new ArrayList<>();
        int dropped = 0;
        int authorColumn = NO_COLUMN;

        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            if (IGNORED_LINE.matcher(line).find()) {
                Matcher header = HEADER.matcher(line);
                if (header.find()) {
                    authorColumn = header.start(1);
                }
                continue;
            }

            Matcher idMatcher = RECORD_ID.matcher(line);
            if (idMatcher.find()) {
                RecordBuilder builder = startRecord(idMatcher.group(1), line.substring(idMatcher.end()), authorColumn);
                if (builder == null) {
                    dropped++;
                } else {
                    builders.add(builder);
                }
                continue;
            }

            if (builders.isEmpty()) {
                log.debug("Dropping continuation line before any record: '{}'", line);
                dropped++;
                continue;
            }

            builders.get(builders.size() - 1).continueWith(line);
        }

        if (dropped > 0) {
            log.warn("Dropped {} malformed catalog listing lines", dropped);
        }

        return builders.stream()
                .map(RecordBuilder::build)
                .toList();
    }

    private RecordBuilder startRecord(String idText, String remainder, int authorColumn) {
        long id;
        try {
            id = Long.parseLong(idText);
        } catch (NumberFormatException ex) {
            log.debug("Catalog id '{}' is not a valid number", idText);
            return null;
        }

        List<String> fields = new ArrayList<>(Arrays.asList(COLUMN_GAP.split(remainder.strip())));

        // A single column left after the id: when it ends in a word it is the author
        if (fields.size() < 2 && WORD_ENDING.matcher(remainder).find()) {
            fields.add(fields.get(fields.size() - 1));
            fields.set(fields.size() - 2, "");
        }

        String title = fields.isEmpty() ? "" : fields.get(0);
        String author = fields.size() > 1 ? fields.get(1) : "";
        return new RecordBuilder(id, title, author, authorColumn);
    }

    private static final int NO_COLUMN = -1;

    private static final class RecordBuilder {
        private final long id;
        private final StringBuilder title;
        private final StringBuilder author;
        private final int authorColumn;

        private RecordBuilder(long id, String title, String author, int authorColumn) {
            this.id = id;
            this.title = new StringBuilder(title);
            this.author = new StringBuilder(author);
            this.authorColumn = authorColumn;
        }

        private void continueWith(String line) {
            if (authorColumn == NO_COLUMN) {
                String[] fragments = COLUMN_GAP.split(line.strip());
                appendTitle(fragments.length > 0 ? fragments[0] : "");
                appendAuthor(fragments.length > 1 ? fragments[1] : "");
                return;
            }

            Matcher fragment = FRAGMENT.matcher(line);
            while (fragment.find()) {
                if (fragment.start() >= authorColumn) {
                    appendAuthor(fragment.group().strip());
                } else {
                    appendTitle(fragment.group().strip());
                }
            }
        }

        private void appendTitle(String fragment) {
            if (!fragment.isEmpty()) {
                boolean glue = title.isEmpty() || JOINING_ENDING.matcher(title).find();
                title.append(glue ? "" : " ").append(fragment);
            }
        }

        private void appendAuthor(String fragment) {
            if (!fragment.isEmpty()) {
                author.append(author.isEmpty() ? "" : " ").append(fragment);
            }
        }

        private CatalogRecord build() {
            return new CatalogRecord(id, title.toString().strip(), author.toString().strip());
        }
    }
}
