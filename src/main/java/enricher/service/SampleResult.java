package enricher.service;

import enricher.model.Row;

import java.util.Map;

/**
 * Outcome of the dry run on one sample row.
 *
 * @param rowNumber 1-based row number
 * @param values    produced values, null when the row failed
 * @param error     failure description, null on success
 */
public record SampleResult(int rowNumber, Row input, Map<String, String> values, String error, long costUnits) {

    public boolean isFailure() {
        return error != null;
    }
}
