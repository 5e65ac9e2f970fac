package at.sv.suggest.mining;

import at.sv.suggest.DiscoveryConfig;
import at.sv.suggest.history.TestHistory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZonedDateTime;
import java.util.List;

import static at.sv.suggest.history.TestHistory.history;
import static org.assertj.core.api.Assertions.assertThat;

class ConditionalPatternMinerTest {

    private static final ZonedDateTime START = ZonedDateTime.parse("2024-01-01T18:00:00Z");

    private ConditionalPatternMiner miner;

    @BeforeEach
    void setUp() {
        miner = new ConditionalPatternMiner(DiscoveryConfig.defaults());
    }

    @Test
    void mine_lightFollowsMotion_onePattern() {
        TestHistory history = history();
        for (int day = 0; day < 3; day++) {
            ZonedDateTime motion = START.plusDays(day).plusMinutes(day * 17);
            history.add("binary_sensor.motion", motion, "on")
                   .add("light.hall", motion.plusSeconds(30), "on");
        }

        List<Pattern> patterns = miner.mine(history.build());

        assertThat(patterns).containsExactly(new ConditionalPattern("light.hall", "light",
                "binary_sensor.motion", "on", "on", 1.0, 3));
    }

    @Test
    void mine_targetAtWindowEnd_included() {
        miner = new ConditionalPatternMiner(DiscoveryConfig.builder().minOccurrences(1).build());

        List<Pattern> patterns = miner.mine(history()
                .add("binary_sensor.door", START, "on")
                .add("light.hall", START.plusSeconds(600), "on")
                .build());

        assertThat(patterns).hasSize(1);
    }

    @Test
    void mine_targetJustAfterWindowEnd_excluded() {
        miner = new ConditionalPatternMiner(DiscoveryConfig.builder().minOccurrences(1).build());

        List<Pattern> patterns = miner.mine(history()
                .add("binary_sensor.door", START, "on")
                .add("light.hall", START.plusSeconds(600).plusNanos(10_000_000), "on")
                .build());

        assertThat(patterns).isEmpty();
    }

    @Test
    void mine_targetAtSameTime_included() {
        miner = new ConditionalPatternMiner(DiscoveryConfig.builder().minOccurrences(1).build());

        List<Pattern> patterns = miner.mine(history()
                .add("binary_sensor.door", START, "on")
                .add("light.hall", START, "on")
                .build());

        assertThat(patterns).hasSize(1);
    }

    @Test
    void mine_targetBeforeCondition_ignored() {
        miner = new ConditionalPatternMiner(DiscoveryConfig.builder().minOccurrences(1).build());

        List<Pattern> patterns = miner.mine(history()
                .add("light.hall", START, "on")
                .add("binary_sensor.door", START.plusSeconds(1), "on")
                .build());

        assertThat(patterns).isEmpty();
    }

    @Test
    void mine_personAsCondition_groupedByConditionState() {
        TestHistory history = history();
        for (int day = 0; day < 3; day++) {
            ZonedDateTime home = START.plusDays(day);
            ZonedDateTime away = home.plusHours(12);
            history.add("person.anna", home, "home")
                   .add("climate.living_room", home.plusMinutes(2), "heat")
                   .add("person.anna", away, "not_home")
                   .add("climate.living_room", away.plusMinutes(1), "off");
        }

        List<Pattern> patterns = miner.mine(history.build());

        assertThat(patterns).containsExactly(
                new ConditionalPattern("climate.living_room", "climate", "person.anna", "home", "heat", 1.0, 3),
                new ConditionalPattern("climate.living_room", "climate", "person.anna", "not_home", "off", 1.0, 3));
    }

    @Test
    void mine_inconsistentReaction_belowThreshold_noPattern() {
        TestHistory history = history();
        String[] reactions = {"on", "off", "on", "off"};
        for (int day = 0; day < reactions.length; day++) {
            ZonedDateTime motion = START.plusDays(day);
            history.add("binary_sensor.motion", motion, "on")
                   .add("light.hall", motion.plusSeconds(30), reactions[day]);
        }

        assertThat(miner.mine(history.build())).isEmpty();
    }

    @Test
    void mine_sensorsNeverTargets_controllablesNeverConditions() {
        TestHistory history = history();
        for (int day = 0; day < 3; day++) {
            ZonedDateTime start = START.plusDays(day);
            history.add("light.a", start, "on")
                   .add("switch.b", start.plusSeconds(5), "on")
                   .add("sensor.lux", start.plusSeconds(10), "high")
                   .add("binary_sensor.motion", start.plusSeconds(15), "on");
        }

        List<Pattern> patterns = miner.mine(history.build());

        assertThat(patterns).isEmpty();
    }

    @Test
    void mine_tooFewConditionEvents_noPattern() {
        TestHistory history = history();
        for (int day = 0; day < 2; day++) {
            ZonedDateTime motion = START.plusDays(day);
            history.add("binary_sensor.motion", motion, "on")
                   .add("light.hall", motion.plusSeconds(30), "on")
                   .add("light.hall", motion.plusSeconds(60), "on");
        }

        assertThat(miner.mine(history.build())).isEmpty();
    }
}
