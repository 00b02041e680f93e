package org.worksindex.service.identifiers;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class DoiExtractor {

    private static final Pattern DOI_PATTERN = Pattern.compile("10\\.[0-9.]+/\\S+");

    private DoiExtractor() {
    }

    public static String extract(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        Matcher matcher = DOI_PATTERN.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String doi = matcher.group().toLowerCase(Locale.ROOT).trim();
        return doi.isEmpty() ? null : doi;
    }
}
