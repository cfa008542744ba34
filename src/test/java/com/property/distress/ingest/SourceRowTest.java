package com.property.distress.ingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SourceRow Tests")
class SourceRowTest {

    private static SourceRow row(String column, String value) {
        Map<String, String> values = new HashMap<>();
        values.put(column, value);
        return SourceRow.of(7, values);
    }

    @Nested
    @DisplayName("Text access")
    class TextTests {

        @Test
        @DisplayName("Blank cells and nan are absent")
        void absentValues() {
            assertNull(row("Status", "   ").text("Status"));
            assertNull(row("Status", "NaN").text("Status"));
            assertNull(row("Status", null).text("Status"));
            assertNull(row("Status", "Open").text("Other"));
            assertEquals("Open", row("Status", "  Open ").text("Status"));
        }

        @Test
        @DisplayName("Column names are trimmed on construction")
        void trimmedColumns() {
            SourceRow row = SourceRow.of(2, Map.of(" Address ", "1 Main St"));

            assertTrue(row.hasColumn("Address"));
            assertEquals("1 Main St", row.text("Address"));
        }

        @Test
        @DisplayName("firstText and joinText skip blank columns")
        void combinedText() {
            SourceRow row = SourceRow.of(2, Map.of("A", " ", "B", "Beta", "C", "Gamma"));

            assertEquals("Beta", row.firstText("A", "B", "C"));
            assertEquals("Beta Gamma", row.joinText("A", "B", "C"));
            assertNull(row.joinText("A", "Z"));
        }

        @Test
        @DisplayName("require reports row and column")
        void require() {
            RecordValidationException e = assertThrows(RecordValidationException.class,
                    () -> row("Instrument", "").require("Instrument"));

            assertEquals(7, e.getRowNumber());
            assertEquals("Instrument", e.getColumn());
            assertTrue(e.getMessage().startsWith("Row 7, column 'Instrument'"));
        }

        @Test
        @DisplayName("with adds a column without touching the original")
        void with() {
            SourceRow original = row("CaseNumber", "P-1");
            SourceRow extended = original.with("SecondaryParty", "JANE DOE");

            assertEquals("JANE DOE", extended.text("SecondaryParty"));
            assertFalse(original.hasColumn("SecondaryParty"));
            assertEquals(original.rowNumber(), extended.rowNumber());
        }
    }

    @Nested
    @DisplayName("Dates")
    class DateTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "3/15/2024",
                "03/15/2024",
                "2024-03-15",
                "3/15/2024 10:30:00 AM",
                "2024-03-15 13:45:00",
                "3/15/2024 9:05 pm",
                "2024-03-15T08:00:00"
        })
        @DisplayName("Should accept the extract date formats")
        void acceptedFormats(String value) {
            assertEquals(LocalDate.of(2024, 3, 15), row("Date", value).date("Date"));
        }

        @Test
        @DisplayName("Unparsable dates are row failures")
        void badDate() {
            RecordValidationException e = assertThrows(RecordValidationException.class,
                    () -> row("Date", "sometime in March").date("Date"));
            assertEquals("Date", e.getColumn());
        }

        @Test
        @DisplayName("Missing dates are null")
        void missingDate() {
            assertNull(row("Date", "").date("Date"));
        }
    }

    @Nested
    @DisplayName("Numbers")
    class NumberTests {

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "$1,234.50  | 1234.50",
                "320000     | 320000",
                "(500.00)   | -500.00",
                "$ 75,000   | 75000"
        })
        @DisplayName("Should parse currency amounts")
        void amounts(String raw, String expected) {
            assertEquals(new BigDecimal(expected), row("Amount", raw).amount("Amount"));
        }

        @Test
        @DisplayName("Bare currency symbols are absent, garbage fails")
        void badAmounts() {
            assertNull(row("Amount", "$").amount("Amount"));
            assertThrows(RecordValidationException.class, () -> row("Amount", "lots").amount("Amount"));
        }

        @Test
        @DisplayName("Should parse spreadsheet integers")
        void integers() {
            assertEquals(Integer.valueOf(2023), row("Tax Yr", "2023.0").integer("Tax Yr"));
            assertEquals(Integer.valueOf(1200), row("N", "1,200").integer("N"));
            assertNull(row("N", "nan").integer("N"));
            assertThrows(RecordValidationException.class, () -> row("N", "2023.5").integer("N"));
        }
    }
}
