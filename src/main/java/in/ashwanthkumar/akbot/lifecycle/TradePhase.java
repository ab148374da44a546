package in.ashwanthkumar.akbot.lifecycle;

/**
 * Lifecycle of the single position a strategy instance may hold.
 * CLOSED is only ever seen inside a transition, the instance resets to IDLE in the same step.
 */
public enum TradePhase {
    // flat, waiting for a signal
    IDLE,
    // signal accepted, waiting for the confirmation delay before sending the bracket
    SIGNAL_PENDING,
    // bracket submitted, entry not yet filled
    BRACKET_SENT,
    // entry filled, take-profit and stop-loss working
    ACTIVE,
    // proactive flatten in flight
    EXITING,
    CLOSED;

    /**
     * @return true when the broker may hold working orders or a position for this phase
     */
    public boolean holdsOrders() {
        return this == BRACKET_SENT || this == ACTIVE || this == EXITING;
    }
}
