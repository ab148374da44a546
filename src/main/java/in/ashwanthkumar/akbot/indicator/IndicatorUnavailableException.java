package in.ashwanthkumar.akbot.indicator;

import in.ashwanthkumar.akbot.TradingException;

/**
 * CCI can't be computed yet: not enough history, or the window has no dispersion.
 * This is an expected condition during warm up.
 */
public class IndicatorUnavailableException extends TradingException {
    public IndicatorUnavailableException(String message) {
        super(message);
    }
}
