package in.ashwanthkumar.akbot.model;

public enum OrderOp {
    BUY,
    SELL;

    /**
     * @return Op that closes a position opened with this op
     */
    public OrderOp opposite() {
        return this == BUY ? SELL : BUY;
    }
}
