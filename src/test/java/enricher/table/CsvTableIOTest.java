package enricher.table;

import enricher.model.Table;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvTableIOTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Loads headers and rows, pads short records, strips the BOM")
    void load() throws IOException {
        Path file = dir.resolve("in.csv");
        Files.writeString(file, "\uFEFFname,city,notes\nAnn,\"Paris, FR\",x\nBob,  Rome\n", StandardCharsets.UTF_8);

        Table table = new CsvTableLoader().load(file);

        assertEquals(List.of("name", "city", "notes"), table.headers());
        assertEquals(2, table.rowCount());
        assertEquals("Paris, FR", table.rows().get(0).get("city"));
        assertEquals("Rome", table.rows().get(1).get("city"));
        assertEquals("", table.rows().get(1).get("notes"));
    }

    @Test
    void customDelimiter() throws IOException {
        Path file = dir.resolve("in.tsv");
        Files.writeString(file, "a\tb\n1\t2\n");

        Table table = TableFormat.CSV.loader('\t').load(file);

        assertEquals(List.of("a", "b"), table.headers());
        assertEquals("2", table.rows().get(0).get("b"));
    }

    @Test
    void emptyFileIsAnError() throws IOException {
        Path file = dir.resolve("empty.csv");
        Files.writeString(file, "");

        assertThrows(IOException.class, () -> new CsvTableLoader().load(file));
    }

    @Test
    @DisplayName("Written file loads back with the same content, commas and quotes included")
    void writeThenLoad() throws IOException {
        Path file = dir.resolve("nested/out.csv");
        List<List<String>> rows = List.of(List.of("1", "say \"hi\", ok"), List.of("2", ""));

        new CsvTableWriter().write(file, List.of("id", "text"), rows);
        Table table = new CsvTableLoader().load(file);

        assertEquals(List.of("id", "text"), table.headers());
        assertEquals(List.of("1", "say \"hi\", ok"), table.rows().get(0).values());
        assertEquals(List.of("2", ""), table.rows().get(1).values());
    }

    @Test
    @DisplayName(".tsv files are detected and split on tabs without a delimiter flag")
    void tsvByExtension() throws IOException {
        Path file = dir.resolve("d.tsv");
        Files.writeString(file, "a\tb\n1\t2\n");

        Table table = TableFormat.of(file).loader().load(file);

        assertEquals(2, table.columnCount());
        assertEquals(List.of("a", "b"), table.headers());
        assertEquals("2", table.rows().get(0).get("b"));
    }

    @Test
    @DisplayName("TSV writer separates fields with tabs and loads back")
    void tsvWriteThenLoad() throws IOException {
        Path file = dir.resolve("out.tsv");

        TableFormat.TSV.writer().write(file, List.of("id", "text"), List.of(List.of("1", "a, b")));

        String first = Files.readAllLines(file, StandardCharsets.UTF_8).get(0);
        assertTrue(first.contains("\t"), first);
        assertFalse(first.contains(","), first);
        Table table = TableFormat.TSV.loader().load(file);
        assertEquals(List.of("1", "a, b"), table.rows().get(0).values());
    }
}
