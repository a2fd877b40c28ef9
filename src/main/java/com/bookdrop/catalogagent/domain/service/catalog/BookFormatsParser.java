package com.bookdrop.catalogagent.domain.service.catalog;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the output of {@code calibredb list -f formats}. Each row holds the book id
 * followed by a bracketed list of file paths, possibly wrapped over several lines.
 */
@Slf4j
@Service
public class BookFormatsParser {

    private static final Pattern IGNORED_LINE = Pattern.compile("^(Fail|id +title|id +formats)");
    private static final Pattern RECORD_ID = Pattern.compile("^(\\d+) +");
    private static final Pattern FORMAT_EXTENSION = Pattern.compile("\\.([a-zA-Z0-9]+)\\b(?=\\s*[,\\]]|\\s*$)");

    public Map<Long, List<String>> parse(String listing) {
        if (listing == null || listing.isEmpty()) {
            return Map.of();
        }
        return parse(Arrays.asList(listing.split("\\R")));
    }

    public Map<Long, List<String>> parse(List<String> lines) {
        Map<Long, StringBuilder> rows = new LinkedHashMap<>();
        StringBuilder current = null;

        for (String line : lines) {
            if (line == null || line.isBlank() || IGNORED_LINE.matcher(line).find()) {
                continue;
            }

            Matcher idMatcher = RECORD_ID.matcher(line);
            if (idMatcher.find()) {
                try {
                    current = rows.computeIfAbsent(Long.parseLong(idMatcher.group(1)), id -> new StringBuilder());
                    current.append(line.substring(idMatcher.end()));
                } catch (NumberFormatException ex) {
                    log.debug("Skipping formats row with invalid id: '{}'", line);
                    current = null;
                }
                continue;
            }

            if (current != null) {
                current.append(line.strip());
            }
        }

        Map<Long, List<String>> formats = new LinkedHashMap<>();
        rows.forEach((id, row) -> formats.put(id, extractFormats(row.toString())));
        return formats;
    }

    public List<String> formatsOf(List<String> lines, long bookId) {
        return parse(lines).getOrDefault(bookId, List.of());
    }

    private List<String> extractFormats(String row) {
        List<String> formats = new ArrayList<>();
        Matcher matcher = FORMAT_EXTENSION.matcher(row);
        while (matcher.find()) {
            String format = matcher.group(1).toLowerCase(Locale.ROOT);
            if (!formats.contains(format)) {
                formats.add(format);
            }
        }
        return formats;
    }
}
