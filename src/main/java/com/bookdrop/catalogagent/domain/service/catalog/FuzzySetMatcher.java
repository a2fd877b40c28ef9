package com.bookdrop.catalogagent.domain.service.catalog;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Word-set comparison of free text. Two strings match when the token set of one
 * is contained in the token set of the other, so word order, casing and the
 * separator characters between words do not matter.
 * <p>
 * An empty string has an empty token set and therefore matches anything; use
 * {@link #matchesNonBlank(String, String)} where that would be a false positive.
 */
public final class FuzzySetMatcher {

    public static final Pattern DEFAULT_SEPARATORS = Pattern.compile("[\\s:_.,]+");
    public static final Pattern TITLE_SEPARATORS = Pattern.compile("\\s+");
    public static final Pattern AUTHOR_SEPARATORS = Pattern.compile("[\\s.]+");

    private FuzzySetMatcher() {
    }

    public static boolean matches(String a, String b) {
        return matches(a, b, DEFAULT_SEPARATORS);
    }

    public static boolean matches(String a, String b, Pattern separators) {
        return isSubsetEitherWay(tokens(a, separators), tokens(b, separators));
    }

    public static boolean matchesNonBlank(String a, String b) {
        if (a == null || a.isBlank() || b == null || b.isBlank()) {
            return false;
        }
        return matches(a, b);
    }

    public static Set<String> tokens(String text, Pattern separators) {
        if (text == null || text.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(separators.split(text.toLowerCase(Locale.ROOT)))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toSet());
    }

    public static boolean isSubsetEitherWay(Set<String> a, Set<String> b) {
        return b.containsAll(a) || a.containsAll(b);
    }
}
