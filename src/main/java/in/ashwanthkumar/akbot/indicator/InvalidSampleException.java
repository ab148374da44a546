package in.ashwanthkumar.akbot.indicator;

import in.ashwanthkumar.akbot.TradingException;

/**
 * Raised when a non-finite or non-positive price is fed to the {@link IndicatorEngine}.
 * The engine state is left untouched.
 */
public class InvalidSampleException extends TradingException {
    public InvalidSampleException(String message) {
        super(message);
    }
}
