package com.querygate.execution;

import com.querygate.engine.ModelCollection;
import com.querygate.engine.ObjectModelRequest;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Re-expresses DMV-style query text as an object-model collection read.
 *
 * <p>Recognizes {@code INFO.*()} / {@code INFO.VIEW.*()} functions and the {@code $SYSTEM}
 * schema rowsets. Text that references none of them, or more than one collection, has no
 * translation.
 */
public class ObjectModelTranslator {
    private static final Pattern INFO_FUNCTION = Pattern.compile(
            "INFO\\.(?:VIEW\\.)?(TABLES|COLUMNS|MEASURES|RELATIONSHIPS|EXPRESSIONS|DATASOURCES)\\s*\\(");
    private static final Pattern TMSCHEMA = Pattern.compile(
            "\\$SYSTEM\\.TMSCHEMA_(TABLES|COLUMNS|MEASURES|RELATIONSHIPS|EXPRESSIONS|DATA_SOURCES)\\b");
    private static final Pattern DBSCHEMA = Pattern.compile("\\$SYSTEM\\.DBSCHEMA_(TABLES|COLUMNS)\\b");
    private static final Pattern MDSCHEMA_MEASURES = Pattern.compile("\\$SYSTEM\\.MDSCHEMA_MEASURES\\b");
    private static final Pattern TABLE_EQUALS = Pattern.compile(
            "\\[(?:Table|TableName|TABLE_NAME)\\]\\s*=\\s*\"((?:[^\"]|\"\")*)\"", Pattern.CASE_INSENSITIVE);

    public Optional<ObjectModelRequest> translate(String text, Map<String, String> identifiers) {
        if (text == null) {
            return Optional.empty();
        }
        String upper = text.toUpperCase(Locale.ROOT);
        Set<ModelCollection> found = new LinkedHashSet<>();
        collect(INFO_FUNCTION, upper, found);
        collect(TMSCHEMA, upper, found);
        collect(DBSCHEMA, upper, found);
        if (MDSCHEMA_MEASURES.matcher(upper).find()) {
            found.add(ModelCollection.MEASURES);
        }
        if (found.size() != 1) {
            return Optional.empty();
        }
        return Optional.of(new ObjectModelRequest(found.iterator().next(), tableFilter(text, identifiers)));
    }

    private static void collect(Pattern pattern, String upper, Set<ModelCollection> out) {
        Matcher m = pattern.matcher(upper);
        while (m.find()) {
            out.add(toCollection(m.group(1)));
        }
    }

    static ModelCollection toCollection(String name) {
        if ("DATASOURCES".equals(name)) {
            return ModelCollection.DATA_SOURCES;
        }
        return ModelCollection.valueOf(name);
    }

    private static String tableFilter(String text, Map<String, String> identifiers) {
        if (identifiers != null && identifiers.get("table") != null) {
            return identifiers.get("table").trim();
        }
        Matcher m = TABLE_EQUALS.matcher(text);
        return m.find() ? m.group(1).replace("\"\"", "\"") : null;
    }
}
