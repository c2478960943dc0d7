package com.querygate.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builders for the engine's INFO.* and table queries, plus hints for engine error messages.
 */
public final class DmvQueries {
    private static final List<String> TABLE_EXPRESSION_KEYWORDS = List.of(
            "SELECTCOLUMNS", "ADDCOLUMNS", "SUMMARIZE", "FILTER",
            "VALUES", "ALL", "INFO.", "TOPN", "SAMPLE", "SUMMARIZECOLUMNS");

    private DmvQueries() {
    }

    /**
     * {@code EVALUATE TOPN(n, INFO.<function>())}, optionally filtered.
     */
    public static String infoQuery(String function, String filterExpr, int topN) {
        String inner = "INFO." + function + "()";
        if (filterExpr != null && !filterExpr.isBlank()) {
            inner = "FILTER(" + inner + ", " + filterExpr + ")";
        }
        return topN > 0 ? "EVALUATE TOPN(" + topN + ", " + inner + ")" : "EVALUATE " + inner;
    }

    public static String tablePreview(String table, int topN) {
        return "EVALUATE TOPN(" + topN + ", " + quoteTable(table) + ")";
    }

    /**
     * Equality filter on a string column, e.g. {@code [Table] = "Sales"}.
     */
    public static String equalsFilter(String column, String value) {
        return "[" + column + "] = \"" + value.replace("\"", "\"\"") + "\"";
    }

    public static String quoteTable(String table) {
        return "'" + escapeString(table) + "'";
    }

    public static String escapeString(String text) {
        return text == null ? null : text.replace("'", "''");
    }

    /**
     * Wrap bare expressions so the engine accepts them: table expressions become
     * {@code EVALUATE TOPN(n, expr)}, scalars become {@code EVALUATE ROW("Value", expr)}.
     * Text that already starts a statement is returned trimmed.
     */
    public static String prepareForExecution(String query, int topN) {
        String trimmed = query.trim();
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (upper.startsWith("EVALUATE") || upper.startsWith("DEFINE") || upper.startsWith("SELECT")) {
            return trimmed;
        }
        if (isTableExpression(upper)) {
            return topN > 0 ? "EVALUATE TOPN(" + topN + ", " + trimmed + ")" : "EVALUATE " + trimmed;
        }
        return "EVALUATE ROW(\"Value\", " + trimmed + ")";
    }

    static boolean isTableExpression(String upperQuery) {
        return TABLE_EXPRESSION_KEYWORDS.stream().anyMatch(upperQuery::contains);
    }

    /**
     * Caller-facing hints derived from an engine error message. The message itself is never
     * returned.
     */
    public static List<String> errorSuggestions(String errorMessage) {
        List<String> suggestions = new ArrayList<>();
        String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
        boolean notFound = lower.contains("not found") || lower.contains("doesn't exist") || lower.contains("does not exist");

        if (lower.contains("table") && notFound) {
            suggestions.add("Verify table exists with list_tables");
            suggestions.add("Check case-sensitive spelling");
            suggestions.add("Try single quotes: 'TableName'");
        }
        if (lower.contains("column") && notFound) {
            suggestions.add("Verify column with describe_table");
            suggestions.add("Check case-sensitive spelling");
            suggestions.add("Try 'Table'[Column] syntax");
        }
        if (lower.contains("syntax")) {
            suggestions.add("Ensure EVALUATE for table expressions");
            suggestions.add("Check balanced delimiters");
            suggestions.add("Verify function parameters");
        }
        if (lower.contains("function")) {
            suggestions.add("Check function name spelling");
            suggestions.add("Verify parameter types/count");
        }
        if (lower.contains("error") && lower.contains("measure")) {
            suggestions.add("Check for circular dependencies");
            suggestions.add("Test expressions individually");
        }
        if (suggestions.isEmpty()) {
            suggestions.add("Check query syntax");
            suggestions.add("Verify references exist");
            suggestions.add("Simplify query to isolate issue");
        }
        return suggestions.stream().distinct().toList();
    }
}
