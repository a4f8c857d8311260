package com.phillippitts.frontdesk.service.routing;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Cheap domain pre-filter: a query is relevant when one of its words starts with a clinic keyword,
 * case-insensitively, so "treatments" and "scheduling" count. Irrelevant queries skip retrieval entirely.
 */
public final class RelevanceFilter {

    private final Pattern pattern;

    public RelevanceFilter(List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            throw new IllegalArgumentException("At least one domain keyword is required");
        }
        String alternatives = keywords.stream()
                .map(String::trim)
                .filter(k -> !k.isEmpty())
                .map(k -> k.toLowerCase(Locale.ROOT))
                .map(k -> Pattern.quote(k).replace(" ", "\\E\\s+\\Q"))
                .collect(Collectors.joining("|"));
        this.pattern = Pattern.compile("\\b(?:" + alternatives + ")",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public boolean isRelevant(String query) {
        return query != null && !query.isBlank() && pattern.matcher(query).find();
    }
}
