package in.ashwanthkumar.akbot.broker;

import in.ashwanthkumar.akbot.TradingException;

/**
 * The broker rejected a bracket or flatten request. Retried on the next tick.
 */
public class OrderSubmissionException extends TradingException {
    public OrderSubmissionException(String message) {
        super(message);
    }

    public OrderSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
