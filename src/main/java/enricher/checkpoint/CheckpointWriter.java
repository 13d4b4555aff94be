package enricher.checkpoint;

import enricher.model.OutputTable;
import enricher.table.TableWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Persists the full output table.
 *
 * <p>Checkpoints go to a working file ({@code <output>.tmp}) and never touch the
 * final artifact. {@link #commit(OutputTable)} writes the working file one last
 * time and moves it over the output path.</p>
 */
public class CheckpointWriter {

    private static final Logger log = LoggerFactory.getLogger(CheckpointWriter.class);

    public static final String WORKING_SUFFIX = ".tmp";

    private final TableWriter writer;
    private final Path outputPath;
    private final Path workingPath;
    private int checkpoints;

    public CheckpointWriter(TableWriter writer, Path outputPath) {
        this.writer = writer;
        this.outputPath = outputPath;
        this.workingPath = outputPath.resolveSibling(outputPath.getFileName() + WORKING_SUFFIX);
    }

    /**
     * Write the table's current state to the working file.
     */
    public void checkpoint(OutputTable table) throws IOException {
        writer.write(workingPath, table.headers(), table.rows());
        checkpoints++;
        log.debug("Checkpoint #{} written to {} ({} of {} rows filled)",
                checkpoints, workingPath, table.writtenRows(), table.rowCount());
    }

    /**
     * Produce the final artifact.
     *
     * @return the output path
     */
    public Path commit(OutputTable table) throws IOException {
        writer.write(workingPath, table.headers(), table.rows());
        try {
            Files.move(workingPath, outputPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", outputPath);
            Files.move(workingPath, outputPath, StandardCopyOption.REPLACE_EXISTING);
        }
        log.info("Output written to {} ({} rows)", outputPath, table.rowCount());
        return outputPath;
    }

    public Path outputPath() {
        return outputPath;
    }

    public Path workingPath() {
        return workingPath;
    }

    /** Number of checkpoints written so far (commits not included). */
    public int checkpointCount() {
        return checkpoints;
    }
}
