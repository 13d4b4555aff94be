package enricher.model;

/**
 * How a pipeline run ended.
 */
public enum RunOutcome {
    /** Every row was dispatched and its result applied */
    COMPLETED,
    /** Stopped early by a shutdown request; undispatched rows keep their placeholders */
    CANCELLED
}
