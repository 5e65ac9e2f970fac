package at.sv.suggest.history;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EntityIdsTest {

    @Test
    void getDomain() {
        assertThat(EntityIds.getDomain("light.living_room")).isEqualTo("light");
        assertThat(EntityIds.getDomain("binary_sensor.door.front")).isEqualTo("binary_sensor");
        assertThat(EntityIds.getDomain("sun")).isEqualTo("sun");
    }

    @Test
    void isControllable_sensorsAreNot_personIs() {
        assertThat(EntityIds.isControllable("light.a")).isTrue();
        assertThat(EntityIds.isControllable("person.anna")).isTrue();
        assertThat(EntityIds.isControllable("sensor.temperature")).isFalse();
        assertThat(EntityIds.isControllable("binary_sensor.motion")).isFalse();
        assertThat(EntityIds.isControllable("sun.sun")).isFalse();
        assertThat(EntityIds.isControllable("weather.home")).isFalse();
    }

    @Test
    void isConditionCandidate() {
        assertThat(EntityIds.isConditionCandidate("device_tracker.phone")).isTrue();
        assertThat(EntityIds.isConditionCandidate("person.anna")).isTrue();
        assertThat(EntityIds.isConditionCandidate("binary_sensor.motion")).isTrue();
        assertThat(EntityIds.isConditionCandidate("light.a")).isFalse();
    }

    @Test
    void sanitize_replacesNonWordCharacters() {
        assertThat(EntityIds.sanitize("light.Living-Room")).isEqualTo("light_living_room");
    }
}
