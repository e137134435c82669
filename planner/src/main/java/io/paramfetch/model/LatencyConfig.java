package io.paramfetch.model;

/**
 * Per-edge maturity model. {@code t95} is days until ~95% of conversions have landed;
 * {@code pathT95} is the cumulative horizon along the anchor path used for cohort queries.
 * A non-positive {@code maturityDays} disables latency handling.
 */
public record LatencyConfig(Double t95, Double pathT95, Double onsetDeltaDays, Integer maturityDays) {

    public static LatencyConfig ofT95(double t95) {
        return new LatencyConfig(t95, null, null, null);
    }

    public boolean enabled() {
        return maturityDays == null || maturityDays > 0;
    }
}
