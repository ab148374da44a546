package in.ashwanthkumar.akbot;

/**
 * Base of every error raised by the engine. Unchecked, callers decide per tick
 * whether to absorb or propagate.
 */
public class TradingException extends RuntimeException {
    public TradingException(String message) {
        super(message);
    }

    public TradingException(String message, Throwable cause) {
        super(message, cause);
    }
}
