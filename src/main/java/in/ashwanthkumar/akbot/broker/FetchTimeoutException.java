package in.ashwanthkumar.akbot.broker;

import in.ashwanthkumar.akbot.TradingException;

import java.time.Duration;

/**
 * The price fetch didn't complete before the next tick was due, the tick is skipped.
 */
public class FetchTimeoutException extends TradingException {
    public FetchTimeoutException(Contract contract, Duration timeout) {
        super("Price fetch for " + contract + " did not complete within " + timeout.toMillis() + "ms");
    }
}
