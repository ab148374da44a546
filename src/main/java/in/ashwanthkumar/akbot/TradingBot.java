package in.ashwanthkumar.akbot;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import in.ashwanthkumar.akbot.broker.BrokerGateway;
import in.ashwanthkumar.akbot.broker.PaperBroker;
import in.ashwanthkumar.akbot.broker.PriceFetcher;
import in.ashwanthkumar.akbot.broker.TimedPriceFetcher;
import in.ashwanthkumar.akbot.config.BotConfig;
import in.ashwanthkumar.akbot.config.ConfigLoader;
import in.ashwanthkumar.akbot.config.StrategyFactory;
import in.ashwanthkumar.akbot.config.StrategySettings;
import in.ashwanthkumar.akbot.engine.ReplayEngine;
import in.ashwanthkumar.akbot.engine.ReplayResult;
import in.ashwanthkumar.akbot.engine.StrategyRunner;
import in.ashwanthkumar.akbot.engine.TickOrchestrator;
import in.ashwanthkumar.akbot.io.PriceSeriesImporter;
import in.ashwanthkumar.akbot.model.PriceSample;
import in.ashwanthkumar.akbot.observability.CompositeEventSink;
import in.ashwanthkumar.akbot.observability.ConsoleAllowList;
import in.ashwanthkumar.akbot.observability.Slf4jEventSink;
import in.ashwanthkumar.akbot.observability.TickJournal;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Runs every configured strategy instance on its own thread. In replay mode each instance
 * gets its own paper broker and a recorded price series, and its journal is written as CSV.
 * In live mode the instances poll a shared broker every {@code checkIntervalSeconds} until
 * their shutdown time.
 */
@Slf4j
public class TradingBot {
    private final BotConfig config;
    private final StrategyFactory factory;
    private final File outputDir;

    public TradingBot(BotConfig config, File outputDir) {
        this.config = config;
        this.factory = new StrategyFactory(config);
        this.outputDir = outputDir;
    }

    public Map<String, ReplayResult> replay(PriceSeriesImporter series) {
        return runAll("Replay", settings -> () -> replay(settings, series));
    }

    /**
     * Run every instance against the broker until each one reaches its shutdown time.
     * Every fetch is bounded by the instance's check interval.
     *
     * @return the finished runner of each instance, keyed by instance name
     */
    public Map<String, StrategyRunner> run(BrokerGateway broker, PriceFetcher fetcher, Clock clock) {
        return runAll("Live run", settings -> () -> run(settings, broker, fetcher, clock));
    }

    StrategyRunner run(StrategySettings settings, BrokerGateway broker, PriceFetcher fetcher, Clock clock) {
        Duration interval = factory.checkInterval(settings);
        TimedPriceFetcher timedFetcher = new TimedPriceFetcher(fetcher, interval);
        try {
            TickOrchestrator orchestrator = factory.create(settings, broker, timedFetcher, new Slf4jEventSink(), clock.instant());
            StrategyRunner runner = new StrategyRunner(orchestrator, interval, clock);
            runner.run();
            return runner;
        } finally {
            timedFetcher.close();
        }
    }

    private <T> Map<String, T> runAll(String mode, Function<StrategySettings, Callable<T>> task) {
        ConsoleAllowList.configure(config.getConsoleAllowList());
        ExecutorService executor = Executors.newFixedThreadPool(config.getStrategies().size(),
                new ThreadFactoryBuilder().setNameFormat("strategy-%d").build());
        try {
            Map<String, Future<T>> futures = new LinkedHashMap<>();
            for (StrategySettings settings : config.getStrategies()) {
                futures.put(settings.getName(), executor.submit(task.apply(settings)));
            }
            Map<String, T> results = new LinkedHashMap<>();
            List<String> failed = new ArrayList<>();
            for (Map.Entry<String, Future<T>> entry : futures.entrySet()) {
                try {
                    results.put(entry.getKey(), entry.getValue().get());
                } catch (ExecutionException e) {
                    log.error("[{}] {} failed", entry.getKey(), mode, e.getCause());
                    failed.add(entry.getKey());
                }
            }
            if (!failed.isEmpty()) {
                throw new TradingException(mode + " failed for " + failed);
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TradingException("Interrupted while waiting for the strategy instances", e);
        } finally {
            executor.shutdownNow();
        }
    }

    ReplayResult replay(StrategySettings settings, PriceSeriesImporter series) {
        ZoneId zone = factory.schedule(settings).getTradeTimezone();
        List<PriceSample> samples = series.samples(zone);
        PaperBroker broker = new PaperBroker(config.getPerOrderCharge());
        TickJournal journal = new TickJournal(zone);
        TickOrchestrator orchestrator = factory.create(settings, broker, broker,
                CompositeEventSink.of(new Slf4jEventSink(), journal), samples.isEmpty() ? Instant.EPOCH : samples.get(0).getTime());
        ReplayResult result = new ReplayEngine(samples, orchestrator, broker).execute();
        journal.writeCsv(outputDir, settings.getName());
        return result;
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: TradingBot <config.json> <prices.csv> [output dir]");
            System.exit(2);
        }
        BotConfig config = ConfigLoader.load(new File(args[0]));
        File outputDir = new File(args.length > 2 ? args[2] : "journal");
        Map<String, ReplayResult> results = new TradingBot(config, outputDir).replay(PriceSeriesImporter.fromCsv(args[1]));
        results.forEach((name, result) -> log.info("{}: {} ticks, {} fills, net P&L {}",
                name, result.getTicks(), result.getFills(), String.format("%.2f", result.netPnl())));
    }
}
