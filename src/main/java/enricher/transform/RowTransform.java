package enricher.transform;

import enricher.core.ShutdownSignal;
import enricher.model.ColumnSpec;
import enricher.model.Row;

import java.util.List;

/**
 * Produces the target column values for one row.
 *
 * <p>Implementations are called concurrently from several worker threads and
 * must be thread-safe. They should return promptly once {@code signal} fires.
 * No retries are done by the caller: one call per row.</p>
 */
@FunctionalInterface
public interface RowTransform {

    /**
     * @param row         the input row, fields in header order
     * @param targets     the columns to produce
     * @param instruction free-text instruction describing what to produce
     * @param signal      shutdown signal of the current run
     * @return a value for every target column plus the cost of the call
     * @throws TransformException on any failure; carries the cost already incurred
     */
    TransformOutcome transform(Row row, List<ColumnSpec> targets, String instruction, ShutdownSignal signal)
            throws TransformException;
}
