package in.ashwanthkumar.akbot.indicator;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Optional;

/**
 * Diagnostic view of every indicator after a given number of samples.
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public class IndicatorSnapshot {
    private final long samplesSeen;
    private final EmaSnapshot emas;
    private final CciReading cci;

    public Optional<CciReading> cciReading() {
        return Optional.ofNullable(cci);
    }
}
