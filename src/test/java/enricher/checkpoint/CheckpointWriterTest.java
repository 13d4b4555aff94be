package enricher.checkpoint;

import enricher.model.ColumnSpec;
import enricher.model.OutputTable;
import enricher.model.Table;
import enricher.table.CsvTableLoader;
import enricher.table.CsvTableWriter;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointWriterTest {

    @TempDir
    Path dir;

    private OutputTable table;
    private CheckpointWriter writer;

    @BeforeEach
    void setUp() {
        Table input = Table.of(List.of("id"), List.of(List.of("1"), List.of("2")));
        table = OutputTable.widen(input, ColumnSpec.parseList("out"));
        writer = new CheckpointWriter(new CsvTableWriter(), dir.resolve("result.csv"));
    }

    @Test
    @DisplayName("Checkpoints go to the working file, never the output")
    void checkpointWritesWorkingFile() throws IOException {
        writer.checkpoint(table);

        assertEquals(dir.resolve("result.csv.tmp"), writer.workingPath());
        assertTrue(Files.exists(writer.workingPath()));
        assertFalse(Files.exists(writer.outputPath()));
        assertEquals(1, writer.checkpointCount());
    }

    @Test
    @DisplayName("Two checkpoints without changes are byte-identical")
    void idempotent() throws IOException {
        table.apply(0, Map.of("out", "a,\"b\""));
        writer.checkpoint(table);
        byte[] first = Files.readAllBytes(writer.workingPath());

        writer.checkpoint(table);
        byte[] second = Files.readAllBytes(writer.workingPath());

        assertArrayEquals(first, second);
    }

    @Test
    @DisplayName("Checkpoint reflects the full table, not a delta")
    void fullSnapshot() throws IOException {
        table.apply(0, Map.of("out", "x"));
        writer.checkpoint(table);
        table.apply(1, Map.of("out", "y"));
        writer.checkpoint(table);

        Table saved = new CsvTableLoader().load(writer.workingPath());
        assertEquals(List.of("id", "out"), saved.headers());
        assertEquals("x", saved.rows().get(0).get("out"));
        assertEquals("y", saved.rows().get(1).get("out"));
    }

    @Test
    @DisplayName("Commit replaces the output and removes the working file")
    void commit() throws IOException {
        Files.writeString(writer.outputPath(), "stale");
        writer.checkpoint(table);
        table.apply(1, Map.of("out", "done"));

        Path result = writer.commit(table);

        assertEquals(writer.outputPath(), result);
        assertFalse(Files.exists(writer.workingPath()));
        Table saved = new CsvTableLoader().load(result);
        assertEquals("done", saved.rows().get(1).get("out"));
        assertEquals("", saved.rows().get(0).get("out"));
    }
}
