package enricher.cli;

import enricher.config.ConfigLoader;
import enricher.config.Dependencies;
import enricher.config.EnrichConfig;
import enricher.core.ShutdownSignal;
import enricher.model.ColumnSpec;
import enricher.model.Row;
import enricher.model.Table;
import enricher.pipeline.PipelineResult;
import enricher.pipeline.ShutdownOrchestrator;
import enricher.progress.ConsoleProgress;
import enricher.progress.ProgressReporter;
import enricher.service.EnrichmentService;
import enricher.service.SampleResult;
import enricher.table.TableFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@code enrich --input <file> --columns <a,b:type> --prompt <text> [flags]}.
 *
 * <p>Loads the table, runs the transform on a few sample rows, asks for
 * confirmation, then enriches every row with progress, checkpoints and
 * interrupt handling, and writes the output file.</p>
 */
public final class EnrichCommand {

    private static final Logger log = LoggerFactory.getLogger(EnrichCommand.class);

    static final int INPUT_PREVIEW_WIDTH = 50;

    private final PrintStream out;
    private final BufferedReader in;
    private final Map<String, String> env;
    private final Path dotEnv;
    private final boolean installHook;

    public EnrichCommand(PrintStream out, BufferedReader in, Map<String, String> env, Path dotEnv, boolean installHook) {
        this.out = out;
        this.in = in;
        this.env = env;
        this.dotEnv = dotEnv;
        this.installHook = installHook;
    }

    /**
     * @return process exit code
     * @throws IOException              if the input cannot be read or the output cannot be written
     * @throws IllegalArgumentException on invalid flags
     */
    public int run(Args args) throws IOException {
        String input = args.stringOrPositional("input");
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("input file is required");
        }
        String columns = args.string("columns");
        if (columns == null || columns.isBlank()) {
            throw new IllegalArgumentException("columns to generate are required");
        }
        String prompt = args.string("prompt");
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("AI prompt is required");
        }
        List<ColumnSpec> targets = ColumnSpec.parseList(columns);
        boolean simulate = args.flag("simulate");

        EnrichConfig config = loadConfig(args);
        if (!simulate && !config.hasApiKey()) {
            throw new IllegalStateException(EnrichConfig.ENV_API_KEY + " not found in environment or .env file");
        }

        Path inputPath = Path.of(input);
        TableFormat inputFormat = TableFormat.of(inputPath);
        TableFormat outputFormat = TableFormat.parse(args.string("format"), inputFormat);
        Path outputPath = args.string("output") != null
                ? Path.of(args.string("output"))
                : TableFormat.defaultOutput(inputPath, outputFormat);

        char delimiter = TableFormat.parseDelimiter(args.string("delimiter"), inputFormat.defaultDelimiter());
        int sheet = args.integer("sheet", TableFormat.FIRST_SHEET);
        if (sheet < 1) {
            throw new IllegalArgumentException("--sheet must be >= 1");
        }
        Table table = inputFormat.loader(delimiter, sheet).load(inputPath);
        out.printf("Loaded %d rows with %d columns%n", table.rowCount(), table.columnCount());
        out.println("Columns to generate: " + String.join(", ", ColumnSpec.names(targets)));
        out.println("Output: " + outputPath);
        out.println();

        try (Dependencies deps = Dependencies.create(config, simulate)) {
            EnrichmentService service = deps.enrichmentService();
            service.validate(table, targets, prompt);

            ShutdownSignal signal = new ShutdownSignal();
            if (config.sampleSize() > 0 && table.rowCount() > 0) {
                printSample(service.sample(table, targets, prompt, config.sampleSize(), signal), config.sampleSize());
                if (!args.flag("yes") && !confirm()) {
                    out.println("Processing cancelled.");
                    return 0;
                }
            }

            out.printf("%nProcessing %d rows with %d workers...%n", table.rowCount(), config.workerCount());
            return runFull(service, config, table, targets, prompt, outputPath, outputFormat, signal);
        }
    }

    private int runFull(EnrichmentService service, EnrichConfig config, Table table, List<ColumnSpec> targets,
            String prompt, Path outputPath, TableFormat format, ShutdownSignal signal) throws IOException {
        ProgressReporter reporter = new ProgressReporter(config.costModel());
        ConsoleProgress progress = new ConsoleProgress(out, reporter);
        ShutdownOrchestrator orchestrator = new ShutdownOrchestrator(signal, out);
        if (installHook) {
            orchestrator.install();
        }

        try {
            PipelineResult result = service.enrich(table, targets, prompt, outputPath, format, progress, signal);
            progress.finish();
            out.println();
            out.print(reporter.summary(result.stats(), result.outcome()));
            if (result.isCancelled()) {
                out.println("\nRun interrupted. Partial results saved to: " + outputPath);
            } else {
                out.println("\nOutput saved to: " + outputPath);
            }
            return 0;
        } finally {
            progress.finish();
            orchestrator.close();
        }
    }

    private EnrichConfig loadConfig(Args args) throws IOException {
        String iniPath = args.string("config");
        EnrichConfig config = ConfigLoader.load(iniPath != null ? new File(iniPath) : null, dotEnv, env);
        if (args.has("workers"))
            config.withWorkers(args.integer("workers", config.workerCount()));
        if (args.has("batch-size"))
            config.withBatchSize(args.integer("batch-size", config.batchSize()));
        if (args.has("sample"))
            config.withSampleSize(args.integer("sample", config.sampleSize()));
        config.validate();
        log.debug("Effective config: {}", config);
        return config;
    }

    private void printSample(List<SampleResult> results, int sampleSize) {
        out.printf("Testing on %d sample rows...%n%n", sampleSize);
        for (SampleResult r : results) {
            if (r.isFailure()) {
                out.printf("Row %d: ERROR - %s%n", r.rowNumber(), r.error());
                continue;
            }
            out.printf("Row %d:%n", r.rowNumber());
            out.println("  Input: " + truncated(r.input()));
            out.println("  Output: " + r.values());
        }
    }

    private boolean confirm() throws IOException {
        out.print("\nProceed with full processing? (y/n): ");
        out.flush();
        String answer = in.readLine();
        return answer != null && answer.trim().toLowerCase(Locale.ROOT).equals("y");
    }

    private static Map<String, String> truncated(Row row) {
        Map<String, String> values = new LinkedHashMap<>();
        row.asMap().forEach((k, v) -> values.put(k,
                v.length() > INPUT_PREVIEW_WIDTH ? v.substring(0, INPUT_PREVIEW_WIDTH) + "..." : v));
        return values;
    }
}
