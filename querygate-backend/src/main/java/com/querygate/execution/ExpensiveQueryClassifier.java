package com.querygate.execution;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether auto mode should time a query instead of previewing it.
 */
@FunctionalInterface
public interface ExpensiveQueryClassifier {

    boolean isExpensive(String text);

    static ExpensiveQueryClassifier never() {
        return text -> false;
    }

    /**
     * Expensive when any pattern (case-insensitive regex) occurs in the text. An empty list
     * never matches.
     */
    static ExpensiveQueryClassifier matchingAny(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return never();
        }
        List<Pattern> compiled = patterns.stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
        return text -> text != null && compiled.stream()
                .anyMatch(p -> p.matcher(text).find());
    }
}
