package at.sv.suggest.history;

import java.util.Locale;
import java.util.Set;

public final class EntityIds {

    /**
     * Domains of entities that only report values and cannot be commanded.
     */
    public static final Set<String> PASSIVE_DOMAINS = Set.of("binary_sensor", "sensor", "sun", "weather");
    /**
     * Domains whose state changes are good candidates for triggering other entities.
     */
    public static final Set<String> CONDITION_DOMAINS = Set.of("binary_sensor", "sensor", "sun", "weather",
            "person", "device_tracker");

    private EntityIds() {
    }

    /**
     * Returns the domain of the given entity id, i.e. the part before the first dot. Ids without a dot are treated
     * as their own domain.
     */
    public static String getDomain(String entityId) {
        int separatorIndex = entityId.indexOf('.');
        if (separatorIndex == -1) {
            return entityId;
        }
        return entityId.substring(0, separatorIndex);
    }

    public static boolean isControllable(String entityId) {
        return !PASSIVE_DOMAINS.contains(getDomain(entityId));
    }

    public static boolean isConditionCandidate(String entityId) {
        return CONDITION_DOMAINS.contains(getDomain(entityId));
    }

    /**
     * Converts the entity id into a form that can be used inside automation ids, e.g. {@code light.Living-Room}
     * becomes {@code light_living_room}.
     */
    public static String sanitize(String entityId) {
        return entityId.toLowerCase(Locale.ROOT).replaceAll("\\W", "_");
    }
}
