package enricher.pipeline;

import enricher.model.OutputTable;
import enricher.model.RunOutcome;
import enricher.model.StatsSnapshot;

/**
 * What a finished run leaves behind.
 *
 * @param table      the output table, target cells filled for every processed row
 * @param stats      final statistics
 * @param outcome    COMPLETED, or CANCELLED if the run stopped before every row was processed
 * @param dispatched number of tasks pulled by workers
 */
public record PipelineResult(OutputTable table, StatsSnapshot stats, RunOutcome outcome, int dispatched) {

    public boolean isCancelled() {
        return outcome == RunOutcome.CANCELLED;
    }
}
