package enricher.model;

/**
 * One row's unit of work. The row index is the only key that ties the
 * eventual {@link RowResult} back to the output table.
 */
public record RowTask(int rowIndex, Row row) {
}
