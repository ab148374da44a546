package in.ashwanthkumar.akbot.broker;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Broker identifiers of the three legs of a submitted bracket.
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor(staticName = "of")
public class BracketHandles {
    private final String entryId;
    private final String takeProfitId;
    private final String stopLossId;

    public boolean isExitLeg(String orderId) {
        return takeProfitId.equals(orderId) || stopLossId.equals(orderId);
    }
}
