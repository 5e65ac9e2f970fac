package at.sv.suggest.mining;

import at.sv.suggest.DiscoveryConfig;
import at.sv.suggest.history.EntityHistory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs all miners over the same histories. With an executor, each miner runs as its own task. The results are always
 * joined in miner order, so the output does not depend on whether an executor is used.
 */
@Slf4j
public final class PatternDiscovery {

    private final List<PatternMiner> miners;
    private final ExecutorService executor;

    public PatternDiscovery(DiscoveryConfig config) {
        this(config, null);
    }

    /**
     * @param executor the executor to run the miners on, or null to run them on the calling thread. The executor is
     *                 not shut down by this class.
     */
    public PatternDiscovery(DiscoveryConfig config, ExecutorService executor) {
        this(createMiners(config), executor);
    }

    public PatternDiscovery(List<PatternMiner> miners, ExecutorService executor) {
        this.miners = List.copyOf(miners);
        this.executor = executor;
    }

    /**
     * The default miners in the order their results are merged: daily, sequence, conditional, periodic.
     */
    public static List<PatternMiner> createMiners(DiscoveryConfig config) {
        return List.of(new DailyPatternMiner(config), new SequencePatternMiner(config),
                new ConditionalPatternMiner(config), new PeriodicPatternMiner(config));
    }

    public List<Pattern> discover(Map<String, EntityHistory> histories) {
        if (histories.isEmpty()) {
            log.debug("No histories to analyze.");
            return List.of();
        }
        Map<String, EntityHistory> readOnlyHistories = Collections.unmodifiableMap(histories);
        List<Pattern> patterns = new ArrayList<>();
        if (executor == null) {
            miners.forEach(miner -> patterns.addAll(runMiner(miner, readOnlyHistories)));
        } else {
            List<Future<List<Pattern>>> futures = new ArrayList<>();
            miners.forEach(miner -> futures.add(executor.submit(() -> runMiner(miner, readOnlyHistories))));
            for (int i = 0; i < futures.size(); i++) {
                patterns.addAll(await(futures.get(i), miners.get(i)));
            }
        }
        log.debug("Discovered {} patterns in {} entity histories.", patterns.size(), readOnlyHistories.size());
        return patterns;
    }

    private static List<Pattern> runMiner(PatternMiner miner, Map<String, EntityHistory> histories) {
        List<Pattern> patterns = miner.mine(histories);
        log.trace("{} miner found {} patterns.", miner.getType().getCategory(), patterns.size());
        return patterns;
    }

    private static List<Pattern> await(Future<List<Pattern>> future, PatternMiner miner) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PatternDiscoveryException("Interrupted while waiting for " + miner.getType().getCategory() + " miner", e);
        } catch (ExecutionException e) {
            throw new PatternDiscoveryException("Failed to run " + miner.getType().getCategory() + " miner: " +
                                                e.getCause().getLocalizedMessage(), e.getCause());
        }
    }
}
