package at.sv.suggest.mining;

import at.sv.suggest.DiscoveryConfig;
import at.sv.suggest.history.EntityHistory;
import at.sv.suggest.history.TestHistory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

import static at.sv.suggest.history.TestHistory.history;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PeriodicPatternMinerTest {

    private static final ZonedDateTime START = ZonedDateTime.parse("2024-01-01T00:10:00Z");

    private PeriodicPatternMiner miner;

    @BeforeEach
    void setUp() {
        miner = new PeriodicPatternMiner(DiscoveryConfig.defaults());
    }

    @Test
    void mine_everyTwoHours_onePattern() {
        List<Pattern> patterns = miner.mine(createHistory("switch.pump", "on", 2.0, 2.0, 2.0, 2.0, 2.0));

        assertThat(patterns).containsExactly(new PeriodicPattern("switch.pump", "switch", "on", 2.0, 1.0, 6));
    }

    @Test
    void mine_slightlyIrregular_confidenceFromDeviation() {
        List<Pattern> patterns = miner.mine(createHistory("switch.pump", "on", 2.0, 2.0, 2.0, 2.0, 2.5));

        assertThat(patterns).hasSize(1);
        PeriodicPattern pattern = (PeriodicPattern) patterns.get(0);
        assertThat(pattern.intervalHours()).isEqualTo(2.0);
        assertThat(pattern.confidence()).isCloseTo(1.0 - 0.2 / 2.1, within(1e-9));
    }

    @Test
    void mine_irregular_noPattern() {
        assertThat(miner.mine(createHistory("switch.pump", "on", 1.0, 5.0, 1.0, 5.0, 1.0))).isEmpty();
    }

    @Test
    void mine_tooFewSamples_noPattern() {
        assertThat(miner.mine(createHistory("switch.pump", "on", 2.0, 2.0, 2.0, 2.0))).isEmpty();
    }

    @Test
    void mine_intervalRoundedToHalfHour() {
        List<Pattern> patterns = miner.mine(createHistory("fan.bath", "on", 1.75, 1.75, 1.75, 1.75, 1.75));

        assertThat(patterns).extracting(pattern -> ((PeriodicPattern) pattern).intervalHours()).containsExactly(2.0);
    }

    @Test
    void mine_fractionalInterval_kept() {
        List<Pattern> patterns = miner.mine(createHistory("fan.bath", "on", 1.4, 1.6, 1.5, 1.5, 1.5));

        assertThat(patterns).extracting(pattern -> ((PeriodicPattern) pattern).intervalHours()).containsExactly(1.5);
    }

    @Test
    void mine_intervalBelowOneHour_noPattern() {
        assertThat(miner.mine(createHistory("fan.bath", "on", 0.5, 0.5, 0.5, 0.5, 0.5))).isEmpty();
    }

    @Test
    void mine_intervalAboveOneDay_noPattern() {
        assertThat(miner.mine(createHistory("fan.bath", "on", 30, 30, 30, 30, 30))).isEmpty();
    }

    @Test
    void mine_exactlyOneDay_included() {
        assertThat(miner.mine(createHistory("fan.bath", "on", 24, 24, 24, 24, 24))).hasSize(1);
    }

    @Test
    void mine_sensor_ignored() {
        assertThat(miner.mine(createHistory("sensor.temperature", "21", 2.0, 2.0, 2.0, 2.0, 2.0))).isEmpty();
    }

    @Test
    void mine_statesEvaluatedSeparately() {
        TestHistory history = history();
        ZonedDateTime on = START;
        for (int i = 0; i < 6; i++) {
            history.add("switch.heater", on, "on")
                   .add("switch.heater", on.plusMinutes(20 + i * 7), "off");
            on = on.plusHours(3);
        }

        List<Pattern> patterns = miner.mine(history.build());

        assertThat(patterns).extracting(pattern -> ((PeriodicPattern) pattern).state()).containsExactly("on", "off");
        assertThat(patterns).extracting(pattern -> ((PeriodicPattern) pattern).intervalHours()).containsExactly(3.0, 3.0);
    }

    @Test
    void roundToHalfHour_quartersRoundToEven() {
        assertThat(PeriodicPatternMiner.roundToHalfHour(1.2)).isEqualTo(1.0);
        assertThat(PeriodicPatternMiner.roundToHalfHour(1.25)).isEqualTo(1.0);
        assertThat(PeriodicPatternMiner.roundToHalfHour(1.3)).isEqualTo(1.5);
        assertThat(PeriodicPatternMiner.roundToHalfHour(1.75)).isEqualTo(2.0);
        assertThat(PeriodicPatternMiner.roundToHalfHour(2.75)).isEqualTo(3.0);
        assertThat(PeriodicPatternMiner.roundToHalfHour(2.25)).isEqualTo(2.0);
    }

    @Test
    void intervalStats_populationStandardDeviation() {
        PeriodicPatternMiner.IntervalStats stats = PeriodicPatternMiner.IntervalStats.of(List.of(
                START, START.plusHours(1), START.plusHours(4)));

        assertThat(stats.mean()).isEqualTo(2.0);
        assertThat(stats.stdDev()).isEqualTo(1.0);
    }

    private static Map<String, EntityHistory> createHistory(String entityId, String state, double... intervalsInHours) {
        TestHistory history = history();
        ZonedDateTime timestamp = START;
        history.add(entityId, timestamp, state);
        for (double interval : intervalsInHours) {
            timestamp = timestamp.plus(Duration.ofSeconds(Math.round(interval * 3600)));
            history.add(entityId, timestamp, state);
        }
        return history.build();
    }
}
