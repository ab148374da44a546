package in.ashwanthkumar.akbot.lifecycle;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public class PhaseTransition {
    private final TradePhase from;
    private final TradePhase to;
    private final String reason;
    // how long the instance stayed in {@code from}
    private final Duration durationInPrevious;
    private final Instant time;
}
