package enricher.service;

import enricher.checkpoint.CheckpointWriter;
import enricher.core.ShutdownSignal;
import enricher.model.ColumnSpec;
import enricher.model.Row;
import enricher.model.Table;
import enricher.pipeline.EnrichmentPipeline;
import enricher.pipeline.PipelineOptions;
import enricher.pipeline.PipelineResult;
import enricher.progress.ProgressListener;
import enricher.table.TableFormat;
import enricher.transform.RowTransform;
import enricher.transform.TransformException;
import enricher.transform.TransformOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Business logic of the {@code enrich} command: validation, the sample dry
 * run, the full pipeline run and the final save.
 */
public class EnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);

    private final RowTransform transform;
    private final PipelineOptions options;

    public EnrichmentService(RowTransform transform, PipelineOptions options) {
        this.transform = transform;
        this.options = options;
    }

    /**
     * Check that the targets can be added to this table.
     *
     * @throws IllegalArgumentException on an empty instruction or a clashing column name
     */
    public void validate(Table table, List<ColumnSpec> targets, String instruction) {
        if (instruction == null || instruction.isBlank()) {
            throw new IllegalArgumentException("AI prompt is required");
        }
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("columns to generate are required");
        }
        for (ColumnSpec spec : targets) {
            if (table.headers().contains(spec.name())) {
                throw new IllegalArgumentException("column already exists in input: " + spec.name());
            }
        }
    }

    /**
     * Run the transform on the first {@code sampleSize} rows, one at a time.
     * Failures are reported per row, never thrown; an outcome missing a target
     * is a failure, as in the full run.
     */
    public List<SampleResult> sample(Table table, List<ColumnSpec> targets, String instruction,
            int sampleSize, ShutdownSignal signal) {
        List<Row> rows = table.head(sampleSize);
        List<SampleResult> results = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            if (signal.isCancelled())
                break;
            Row row = rows.get(i);
            try {
                TransformOutcome outcome = transform.transform(row, targets, instruction, signal);
                List<String> missing = outcome.missing(targets);
                if (missing.isEmpty()) {
                    results.add(new SampleResult(i + 1, row, outcome.values(), null, outcome.costUnits()));
                } else {
                    results.add(new SampleResult(i + 1, row, null, TransformOutcome.missingMessage(missing),
                            outcome.costUnits()));
                }
            } catch (TransformException e) {
                log.debug("Sample row {} failed: {}", i + 1, e.getMessage());
                results.add(new SampleResult(i + 1, row, null, e.getMessage(), e.costUnits()));
            } catch (RuntimeException e) {
                log.warn("Sample row {} failed with unexpected error", i + 1, e);
                results.add(new SampleResult(i + 1, row, null, String.valueOf(e.getMessage()), 0));
            }
        }
        return results;
    }

    /**
     * Enrich every row, checkpointing to {@code <output>.tmp}, then write the
     * final artifact (also after cancellation).
     *
     * @throws IOException if the final artifact cannot be written
     */
    public PipelineResult enrich(Table table, List<ColumnSpec> targets, String instruction,
            Path output, TableFormat format, ProgressListener progress, ShutdownSignal signal) throws IOException {
        validate(table, targets, instruction);

        CheckpointWriter checkpoints = new CheckpointWriter(format.writer(), output);
        PipelineResult result = new EnrichmentPipeline(transform, options)
                .run(table, targets, instruction, checkpoints, progress, signal);

        checkpoints.commit(result.table());
        log.info("Saved {} ({}, {} of {} rows processed)", output, result.outcome(),
                result.stats().processed(), result.stats().totalRows());
        return result;
    }

    public PipelineOptions options() {
        return options;
    }
}
