package enricher;

import enricher.cli.Args;
import enricher.cli.EnrichCommand;
import enricher.cli.PreviewCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Random;
import java.util.Set;

/**
 * Command line entry point.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final Set<String> BOOLEAN_FLAGS = Set.of("yes", "simulate", "help", "h");

    private App() {
    }

    public static void main(String[] argv) {
        System.exit(run(argv, System.out, System.err, true));
    }

    /**
     * @return process exit code: 0 on success or user cancellation, 1 on error
     */
    static int run(String[] argv, PrintStream out, PrintStream err, boolean installHook) {
        try {
            Args args = Args.parse(argv, BOOLEAN_FLAGS);
            String command = args.command();
            if (args.flag("help") || args.flag("h")) {
                usage(out);
                return 0;
            }
            if (command == null) {
                usage(out);
                return 1;
            }

            switch (command) {
                case "preview":
                case "read-csv":
                case "read-excel":
                    return new PreviewCommand(out, new Random()).run(args);
                case "enrich":
                case "process-data":
                    BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                    return new EnrichCommand(out, in, System.getenv(), Path.of(".env"), installHook).run(args);
                case "help":
                    usage(out);
                    return 0;
                default:
                    err.println("Error: Unknown command '" + command + "'");
                    usage(out);
                    return 1;
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.debug("Invalid invocation", e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Command failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static void usage(PrintStream out) {
        out.println("Table Enricher - AI data enrichment for tabular files");
        out.println();
        out.println("Usage: enricher <command> [flags]");
        out.println();
        out.println("Commands:");
        out.println("  preview       Read and analyze a CSV, TSV, JSONL or Excel file (aliases: read-csv, read-excel)");
        out.println("  enrich        Process data with AI to add new columns (alias: process-data)");
        out.println("  help          Show this help");
        out.println();
        out.println("preview flags:");
        out.println("  <file>                  file to read (.csv, .tsv, .txt, .jsonl, .ndjson, .xlsx)");
        out.println("  --rows N                rows to display (default 20)");
        out.println("  --sample first|random   which rows to display (default first)");
        out.println("  --delimiter C           field delimiter, \\t or tab for a tab (default , or tab for .tsv)");
        out.println("  --sheet N               Excel sheet number, 1-based (default 1)");
        out.println();
        out.println("enrich flags:");
        out.println("  --input FILE            input file (or first positional argument)");
        out.println("  --output FILE           output file (default <input>_enriched.<ext>)");
        out.println("  --columns LIST          columns to generate, e.g. \"country,risk_level:number\"");
        out.println("  --prompt TEXT           instruction describing what to extract");
        out.println("  --sample N              rows to test before full processing (default 5)");
        out.println("  --batch-size N          save progress every N rows (default 100)");
        out.println("  --workers N             parallel workers (default 10)");
        out.println("  --format F              output format: same, csv, tsv, jsonl or xlsx (default same)");
        out.println("  --delimiter C           input field delimiter, \\t or tab for a tab (default , or tab for .tsv)");
        out.println("  --sheet N               Excel sheet number, 1-based (default 1)");
        out.println("  --config FILE           ini file with [OPENAI], [PIPELINE], [COST] sections");
        out.println("  --yes                   skip the confirmation prompt");
        out.println("  --simulate              use an offline simulated model");
        out.println();
        out.println("Examples:");
        out.println("  enricher preview data.csv --rows 50 --sample random");
        out.println("  enricher enrich --input travel.csv --columns \"country,risk_level\" \\");
        out.println("    --prompt \"Extract destination country ISO code and assess risk level\"");
    }
}
