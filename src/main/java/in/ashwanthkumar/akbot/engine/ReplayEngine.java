package in.ashwanthkumar.akbot.engine;

import in.ashwanthkumar.akbot.broker.PaperBroker;
import in.ashwanthkumar.akbot.model.PriceSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Drives an orchestrator over a recorded price series. The sample time is the clock,
 * so a replay is fully deterministic.
 */
@Slf4j
@RequiredArgsConstructor
public class ReplayEngine {
    private final List<PriceSample> samples;
    private final TickOrchestrator orchestrator;
    private final PaperBroker broker;

    public ReplayResult execute() {
        int ticks = 0;
        for (PriceSample sample : samples) {
            if (orchestrator.isFinished()) {
                log.info("[{}] Shut down at {}, {} samples left unplayed", orchestrator.getInstance(), sample.getTime(), samples.size() - ticks);
                break;
            }
            // the broker sees the price first, so exit legs crossed by it fill before the tick reads them
            broker.publish(orchestrator.getContract(), sample);
            orchestrator.tick(sample.getTime());
            ticks++;
        }
        ReplayResult result = new ReplayResult(orchestrator.getInstance(), ticks, orchestrator.getProcessedTicks(),
                broker.getOrderBook().size(), broker.getPnl(), broker.getCharges(),
                orchestrator.getLifecycle().getPhase(), orchestrator.isFinished());
        log.info("[{}] Replay done: {}", orchestrator.getInstance(), result);
        return result;
    }
}
