package enricher.cli;

import enricher.model.Table;
import enricher.table.TableFormat;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the enrich command end to end against the simulated model.
 */
class EnrichCommandTest {

    private static final Set<String> FLAGS = Set.of("yes", "simulate");

    @TempDir
    Path dir;

    private Path input;
    private ByteArrayOutputStream buffer;

    @BeforeEach
    void setUp() throws IOException {
        input = dir.resolve("travel.csv");
        StringBuilder sb = new StringBuilder("traveler,destination\n");
        for (int i = 1; i <= 12; i++) {
            sb.append("T").append(i).append(",City ").append(i).append('\n');
        }
        Files.writeString(input, sb.toString());
        buffer = new ByteArrayOutputStream();
    }

    private EnrichCommand command(String stdin) {
        return new EnrichCommand(new PrintStream(buffer, true, StandardCharsets.UTF_8),
                new BufferedReader(new StringReader(stdin)), Map.of(), dir.resolve(".env"), false);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Simulated run with --yes writes <input>_enriched.csv")
    void simulatedRun() throws IOException {
        int code = command("").run(Args.parse(new String[]{
                "enrich", "--input", input.toString(), "--columns", "country,risk_level",
                "--prompt", "Find the country", "--sample", "2", "--workers", "4", "--simulate", "--yes"}, FLAGS));

        assertEquals(0, code);
        Path output = dir.resolve("travel_enriched.csv");
        assertTrue(Files.exists(output));

        Table written = TableFormat.CSV.loader().load(output);
        assertEquals(12, written.rowCount());
        assertEquals("risk_level", written.headers().get(3));
        assertEquals("T12", written.rows().get(11).get("traveler"));
        assertFalse(written.rows().get(11).get("country").isEmpty());

        String out = output();
        assertTrue(out.contains("Loaded 12 rows with 2 columns"));
        assertTrue(out.contains("Testing on 2 sample rows..."));
        assertTrue(out.contains("Row 1:"));
        assertTrue(out.contains("=== FINAL STATISTICS ==="));
        assertTrue(out.contains("Output saved to: " + output));
    }

    @Test
    @DisplayName("Declining the confirmation exits cleanly without output")
    void declined() throws IOException {
        int code = command("n\n").run(Args.parse(new String[]{
                "enrich", input.toString(), "--columns", "country", "--prompt", "x",
                "--sample", "1", "--simulate"}, FLAGS));

        assertEquals(0, code);
        assertTrue(output().contains("Proceed with full processing? (y/n): "));
        assertTrue(output().contains("Processing cancelled."));
        assertFalse(Files.exists(dir.resolve("travel_enriched.csv")));
    }

    @Test
    void jsonlOutputFormat() throws IOException {
        Path output = dir.resolve("result.jsonl");
        int code = command("y\n").run(Args.parse(new String[]{
                "enrich", input.toString(), "--columns", "country", "--prompt", "x", "--sample", "0",
                "--format", "jsonl", "--output", output.toString(), "--simulate"}, FLAGS));

        assertEquals(0, code);
        assertEquals(12, TableFormat.JSONL.loader().load(output).rowCount());
    }

    @Test
    @DisplayName("A .tsv input is read on tabs and written back as <input>_enriched.tsv")
    void tsvInput() throws IOException {
        Path tsv = dir.resolve("travel.tsv");
        Files.writeString(tsv, "traveler\tdestination\nT1\tCity, North\nT2\tCity 2\n");

        int code = command("").run(Args.parse(new String[]{
                "enrich", tsv.toString(), "--columns", "country", "--prompt", "x", "--sample", "0",
                "--simulate", "--yes"}, FLAGS));

        assertEquals(0, code);
        Path output = dir.resolve("travel_enriched.tsv");
        Table written = TableFormat.TSV.loader().load(output);
        assertEquals(3, written.columnCount());
        assertEquals("City, North", written.rows().get(0).get("destination"));
    }

    @Test
    @DisplayName("An Excel input is enriched into <input>_enriched.xlsx")
    void xlsxInput() throws IOException {
        Path xlsx = dir.resolve("travel.xlsx");
        Table source = TableFormat.CSV.loader().load(input);
        TableFormat.XLSX.writer().write(xlsx, source.headers(),
                source.rows().stream().map(r -> r.values()).toList());

        int code = command("").run(Args.parse(new String[]{
                "enrich", xlsx.toString(), "--columns", "country", "--prompt", "x", "--sample", "0",
                "--sheet", "1", "--simulate", "--yes"}, FLAGS));

        assertEquals(0, code);
        Table written = TableFormat.XLSX.loader().load(dir.resolve("travel_enriched.xlsx"));
        assertEquals(12, written.rowCount());
        assertEquals("country", written.headers().get(2));
        assertFalse(written.rows().get(0).get("country").isEmpty());
    }

    @Test
    void sheetOutOfRangeRejected() throws IOException {
        Path xlsx = dir.resolve("one.xlsx");
        TableFormat.XLSX.writer().write(xlsx, List.of("a"), List.of(List.of("1")));

        assertThrows(IllegalArgumentException.class, () -> command("").run(Args.parse(new String[]{
                "enrich", xlsx.toString(), "--columns", "country", "--prompt", "x", "--sheet", "2",
                "--simulate", "--yes"}, FLAGS)));
    }

    @Test
    @DisplayName("Without --simulate an API key is required")
    void requiresApiKey() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> command("").run(Args.parse(
                new String[]{"enrich", input.toString(), "--columns", "country", "--prompt", "x", "--yes"}, FLAGS)));
        assertTrue(e.getMessage().contains("OPENAI_API_KEY"));
    }

    @Test
    void missingArguments() {
        assertThrows(IllegalArgumentException.class, () -> command("").run(Args.parse(
                new String[]{"enrich", "--columns", "country", "--prompt", "x"}, FLAGS)));
        assertThrows(IllegalArgumentException.class, () -> command("").run(Args.parse(
                new String[]{"enrich", input.toString(), "--prompt", "x"}, FLAGS)));
        assertThrows(IllegalArgumentException.class, () -> command("").run(Args.parse(
                new String[]{"enrich", input.toString(), "--columns", "country"}, FLAGS)));
    }

    @Test
    void clashingColumnRejected() {
        assertThrows(IllegalArgumentException.class, () -> command("").run(Args.parse(new String[]{
                "enrich", input.toString(), "--columns", "destination", "--prompt", "x", "--simulate", "--yes"}, FLAGS)));
    }
}
