package in.ashwanthkumar.akbot.broker;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Everything the engine needs from broker connectivity. The transport behind it is not the engine's concern.
 */
public interface BrokerGateway extends PriceFetcher {
    /**
     * Submit the three legs of a bracket.
     *
     * @param order bracket to submit
     * @return identifiers of the submitted legs
     * @throws OrderSubmissionException when the broker rejects the bracket
     */
    BracketHandles submitBracket(BracketOrder order);

    /**
     * Cancel every working order on the contract.
     */
    void cancelAll(Contract contract);

    /**
     * Close any open position on the contract with a market order.
     *
     * @return id of the closing order, empty when there was nothing to close
     * @throws OrderSubmissionException when the broker rejects the closing order
     */
    Optional<String> flatten(Contract contract);

    boolean hasOpenPosition(Contract contract);

    /**
     * Register for execution reports. Listeners may be called from the broker's own thread.
     */
    void addFillListener(Consumer<Fill> listener);
}
