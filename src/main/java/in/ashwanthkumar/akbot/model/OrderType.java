package in.ashwanthkumar.akbot.model;

public enum OrderType {
    // Market Order, filled at the LTP (Last Traded Price)
    MARKET,

    // Limit Order, used for the take-profit leg of a bracket. Depending on
    // BUY or SELL we wait for the price to be breached on either side.
    LIMIT,

    // Stop Order, used for the stop-loss leg of a bracket. Converted to a
    // MARKET order once the trigger price is touched.
    STOP,
}
