package com.sassed.syntax;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Call-site arguments. {@code rest} and {@code keywordRest} are the spread {@code $args...}
 * expressions, or null.
 */
public record ArgumentList(List<Expression> positional, Map<String, Expression> keywords,
                           Expression rest, Expression keywordRest) {
    public static final ArgumentList EMPTY = new ArgumentList(List.of(), Map.of(), null, null);

    public ArgumentList {
        positional = List.copyOf(positional);
        keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    public boolean isEmpty() {
        return positional.isEmpty() && keywords.isEmpty() && rest == null && keywordRest == null;
    }
}
