package com.querygate.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DmvQueriesTest {

    @Test
    void testInfoQuery() {
        assertEquals("EVALUATE TOPN(100, INFO.TABLES())", DmvQueries.infoQuery("TABLES", null, 100));
        assertEquals("EVALUATE FILTER(INFO.VIEW.COLUMNS(), [Table] = \"Sales\")",
                DmvQueries.infoQuery("VIEW.COLUMNS", DmvQueries.equalsFilter("Table", "Sales"), 0));
    }

    @Test
    void testQuoting() {
        assertEquals("EVALUATE TOPN(5, 'O''Brien')", DmvQueries.tablePreview("O'Brien", 5));
        assertEquals("[Table] = \"A \"\"B\"\"\"", DmvQueries.equalsFilter("Table", "A \"B\""));
        assertNull(DmvQueries.escapeString(null));
    }

    @Test
    void testPrepareForExecution() {
        assertEquals("EVALUATE Sales", DmvQueries.prepareForExecution("  EVALUATE Sales ", 10));
        assertEquals("DEFINE MEASURE Sales[X] = 1 EVALUATE Sales",
                DmvQueries.prepareForExecution("DEFINE MEASURE Sales[X] = 1 EVALUATE Sales", 10));
        assertEquals("SELECT * FROM $SYSTEM.TMSCHEMA_TABLES",
                DmvQueries.prepareForExecution("SELECT * FROM $SYSTEM.TMSCHEMA_TABLES", 10));
        assertEquals("EVALUATE TOPN(10, INFO.TABLES())", DmvQueries.prepareForExecution("INFO.TABLES()", 10));
        assertEquals("EVALUATE VALUES(Sales[Region])", DmvQueries.prepareForExecution("VALUES(Sales[Region])", 0));
        assertEquals("EVALUATE ROW(\"Value\", 1 + 1)", DmvQueries.prepareForExecution("1 + 1", 10));
    }

    @Test
    void testErrorSuggestions() {
        List<String> table = DmvQueries.errorSuggestions("Table 'Salez' was not found");
        assertTrue(table.contains("Verify table exists with list_tables"));

        List<String> syntax = DmvQueries.errorSuggestions("Syntax error near token");
        assertTrue(syntax.contains("Ensure EVALUATE for table expressions"));

        List<String> generic = DmvQueries.errorSuggestions(null);
        assertEquals(List.of("Check query syntax", "Verify references exist", "Simplify query to isolate issue"), generic);
    }

    @Test
    void testErrorSuggestionsAreDistinct() {
        List<String> both = DmvQueries.errorSuggestions("Column 'X' in table 'Y' not found");

        assertEquals(1, both.stream().filter("Check case-sensitive spelling"::equals).count());
        assertTrue(both.contains("Verify column with describe_table"));
    }
}
