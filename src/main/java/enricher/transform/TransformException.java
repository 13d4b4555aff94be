package enricher.transform;

/**
 * A row could not be transformed. The row is recorded as failed; the run goes on.
 */
public class TransformException extends Exception {

    private final long costUnits;

    public TransformException(String message) {
        this(message, 0, null);
    }

    public TransformException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public TransformException(String message, long costUnits, Throwable cause) {
        super(message, cause);
        this.costUnits = costUnits;
    }

    /** Cost units consumed before the failure (e.g. tokens billed for an unusable reply). */
    public long costUnits() {
        return costUnits;
    }
}
