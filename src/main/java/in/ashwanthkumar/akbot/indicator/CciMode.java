package in.ashwanthkumar.akbot.indicator;

/**
 * Dispersion measure used to normalise CCI. Fixed per engine instance.
 */
public enum CciMode {
    // sample standard deviation of the typical prices
    STDEV,
    // mean absolute deviation around the mean, the textbook Lambert definition
    CLASSIC;

    public static CciMode of(boolean classic) {
        return classic ? CLASSIC : STDEV;
    }
}
