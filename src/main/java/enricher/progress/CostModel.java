package enricher.progress;

/**
 * Converts cost units (tokens) into an estimated price.
 * Input and output tokens are not tracked separately, so the rate is the mean
 * of the two per-million prices.
 */
public record CostModel(double inputPricePerMillion, double outputPricePerMillion) {

    /** gpt-4o-mini list prices in USD per million tokens. */
    public static final CostModel GPT_4O_MINI = new CostModel(0.15, 0.60);

    public CostModel {
        if (inputPricePerMillion < 0 || outputPricePerMillion < 0) {
            throw new IllegalArgumentException("prices must be >= 0");
        }
    }

    /** Average price of a single unit. */
    public double ratePerUnit() {
        return (inputPricePerMillion + outputPricePerMillion) / 2 / 1_000_000;
    }

    public double estimate(long units) {
        return units * ratePerUnit();
    }
}
