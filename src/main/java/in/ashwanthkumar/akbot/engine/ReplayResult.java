package in.ashwanthkumar.akbot.engine;

import in.ashwanthkumar.akbot.lifecycle.TradePhase;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@RequiredArgsConstructor
public class ReplayResult {
    private final String instance;
    private final int ticks;
    private final long processedTicks;
    private final int fills;
    private final double pnl;
    private final double charges;
    private final TradePhase finalPhase;
    private final boolean shutDown;

    public double netPnl() {
        return pnl - charges;
    }
}
