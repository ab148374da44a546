package in.ashwanthkumar.akbot.broker;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import in.ashwanthkumar.akbot.TradingException;
import in.ashwanthkumar.akbot.model.PriceSample;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.*;

/**
 * Bounds a blocking price fetch by the tick interval. A fetch that doesn't finish
 * in time is cancelled and reported as {@link FetchTimeoutException}, it is never queued.
 */
@Slf4j
public class TimedPriceFetcher implements PriceFetcher, AutoCloseable {
    private final PriceFetcher delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimedPriceFetcher(PriceFetcher delegate, Duration timeout) {
        this.delegate = delegate;
        this.timeout = timeout;
        this.executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("price-fetch-%d")
                .setDaemon(true)
                .build());
    }

    @Override
    public PriceSample fetchPrice(Contract contract) {
        Future<PriceSample> future = executor.submit(() -> delegate.fetchPrice(contract));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new FetchTimeoutException(contract, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new TradingException("Price fetch for " + contract + " failed", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TradingException("Interrupted while fetching the price of " + contract, e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
