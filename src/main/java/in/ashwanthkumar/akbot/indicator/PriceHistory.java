package in.ashwanthkumar.akbot.indicator;

import com.google.common.base.Preconditions;
import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;
import in.ashwanthkumar.akbot.model.PriceSample;

import java.util.List;

/**
 * Append-only window of the most recent samples. The oldest sample is evicted once the cap is reached.
 */
public class PriceHistory {
    private final int capacity;
    private final EvictingQueue<PriceSample> samples;

    public PriceHistory(int capacity) {
        Preconditions.checkArgument(capacity > 0, "History capacity must be positive, got %s", capacity);
        this.capacity = capacity;
        this.samples = EvictingQueue.create(capacity);
    }

    void append(PriceSample sample) {
        samples.add(sample);
    }

    public int size() {
        return samples.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    /**
     * @param n number of samples
     * @return typical prices of the last {@code n} samples, oldest first
     */
    public double[] lastTypicalPrices(int n) {
        Preconditions.checkArgument(n <= samples.size(), "Only %s samples available, %s requested", samples.size(), n);
        List<PriceSample> all = ImmutableList.copyOf(samples);
        double[] out = new double[n];
        int offset = all.size() - n;
        for (int i = 0; i < n; i++) {
            out[i] = all.get(offset + i).typicalPrice();
        }
        return out;
    }

    public List<PriceSample> snapshot() {
        return ImmutableList.copyOf(samples);
    }
}
