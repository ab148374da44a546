package in.ashwanthkumar.akbot.broker;

import in.ashwanthkumar.akbot.model.PriceSample;

@FunctionalInterface
public interface PriceFetcher {
    /**
     * Fetch the latest price of the contract. May block.
     *
     * @param contract contract to price
     * @return latest sample
     */
    PriceSample fetchPrice(Contract contract);
}
