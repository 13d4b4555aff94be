package enricher.service;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DataTypeTest {

    @Test
    void numbers() {
        assertEquals(DataType.NUMBER, DataType.detect(List.of("12", "3.5", "-7", "1e3", "42")));
    }

    @Test
    void dates() {
        assertEquals(DataType.DATE, DataType.detect(List.of("2024-01-15", "03/15/2024", "Jan 5, 2023", "2023-06-01 10:00:00")));
    }

    @Test
    void booleans() {
        assertEquals(DataType.BOOLEAN, DataType.detect(List.of("true", "False", "yes", "NO")));
    }

    @Test
    void strings() {
        assertEquals(DataType.STRING, DataType.detect(List.of("Paris", "Rome", "Oslo", "Lima", "")));
    }

    @Test
    @DisplayName("Blank values are ignored when computing the share")
    void blanksIgnored() {
        assertEquals(DataType.NUMBER, DataType.detect(List.of("1.5", "", "  ", "2.5")));
    }

    @Test
    @DisplayName("No type reaching 80% of non-empty values is mixed")
    void mixed() {
        assertEquals(DataType.MIXED, DataType.detect(List.of("12", "13", "Paris", "Rome", "2024-01-01")));
    }

    @Test
    void empty() {
        assertEquals(DataType.EMPTY, DataType.detect(List.of("", " ")));
        assertEquals(DataType.EMPTY, DataType.detect(List.of()));
    }

    @Test
    void strictDates() {
        assertTrue(DataType.isDate("2024-02-29"));
        assertFalse(DataType.isDate("02/30/2023"));
        assertFalse(DataType.isDate("tomorrow"));
    }

    @Test
    void numberShapes() {
        assertTrue(DataType.isNumber(".5"));
        assertTrue(DataType.isNumber("+3."));
        assertFalse(DataType.isNumber("1,000"));
        assertFalse(DataType.isNumber("12abc"));
    }
}
