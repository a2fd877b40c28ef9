package com.bookdrop.catalogagent.domain.service;

import com.bookdrop.catalogagent.domain.model.BookFileName;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class FileNameParser {

    private static final Pattern EXTENSION = Pattern.compile("\\.([a-zA-Z0-9]+)$");

    public BookFileName parse(String fileName) {
        if (fileName == null) {
            return new BookFileName("", "", "");
        }

        String name = fileName.strip();
        int lastSeparator = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (lastSeparator >= 0) {
            name = name.substring(lastSeparator + 1);
        }

        Matcher matcher = EXTENSION.matcher(name);
        if (!matcher.find()) {
            return new BookFileName(name, name, "");
        }

        return new BookFileName(name, name.substring(0, matcher.start()), matcher.group(1).toLowerCase(Locale.ROOT));
    }
}
