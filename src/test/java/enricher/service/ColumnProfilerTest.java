package enricher.service;

import enricher.model.Row;
import enricher.model.Table;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ColumnProfilerTest {

    private static Table table(int rows) {
        List<List<String>> records = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            records.add(List.of(String.valueOf(i), "city-" + (i % 3)));
        }
        return Table.of(List.of("id", "city"), records);
    }

    @Test
    @DisplayName("Profiles count unique values and nulls, samples are capped and truncated")
    void profile() {
        Table t = Table.of(List.of("name", "score"), List.of(
                List.of("A very long customer name", "1"),
                List.of("Bob", "null"),
                List.of("Bob", ""),
                List.of("Cy", "NIL")));

        List<ColumnProfile> profiles = ColumnProfiler.profile(t);

        ColumnProfile name = profiles.get(0);
        assertEquals("name", name.name());
        assertEquals(3, name.uniqueCount());
        assertEquals(0, name.nullCount());
        assertEquals(4, name.totalCount());
        assertEquals(List.of("A very long ...", "Bob", "Cy"), name.samples());

        ColumnProfile score = profiles.get(1);
        assertEquals(3, score.nullCount());
        assertEquals(1, score.index());
    }

    @Test
    void samplesCappedAtFive() {
        ColumnProfile id = ColumnProfiler.profile(table(12)).get(0);

        assertEquals(ColumnProfiler.SAMPLE_VALUES, id.samples().size());
        assertEquals(DataType.NUMBER, id.type());
    }

    @Test
    void firstRows() {
        List<Row> rows = ColumnProfiler.selectRows(table(30), 5, false, new Random(1));

        assertEquals(5, rows.size());
        assertEquals("0", rows.get(0).get("id"));
        assertEquals("4", rows.get(4).get("id"));
    }

    @Test
    @DisplayName("Random selection returns distinct rows")
    void randomRows() {
        List<Row> rows = ColumnProfiler.selectRows(table(30), 10, true, new Random(42));

        assertEquals(10, rows.size());
        HashSet<String> ids = new HashSet<>();
        rows.forEach(r -> ids.add(r.get("id")));
        assertEquals(10, ids.size());
    }

    @Test
    void smallTableReturnsAll() {
        assertEquals(3, ColumnProfiler.selectRows(table(3), 20, true, new Random()).size());
    }

    @Test
    void truncate() {
        assertEquals("short", ColumnProfiler.truncate("short", 15));
        assertEquals("abcdefg...", ColumnProfiler.truncate("abcdefghijklmnop", 10));
        assertEquals("...", ColumnProfiler.truncate("abcdef", 2));
    }
}
