package dev.healthtrends.evidence.score;

/** Contribution of a single component to the total evidence score. */
public record ComponentScore(
        Component component,
        /** unweighted component score in [0, 10] */
        double raw,
        double weight,
        /** raw * weight, in [0, weight * 10] */
        double weighted,
        /** human readable explanation of how the raw score was reached */
        String detail) {

    static ComponentScore of(Component component, double raw, double weight, String detail) {
        return new ComponentScore(component, raw, weight, raw * weight, detail);
    }
}
