package at.sv.suggest.history;

import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * A single recorded state of an entity.
 */
public record StateEvent(String entityId, ZonedDateTime timestamp, String state) {

    public StateEvent {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(state, "state");
    }

    public String domain() {
        return EntityIds.getDomain(entityId);
    }

    @Override
    public String toString() {
        return "[" + entityId + "=" + state + "@" + timestamp + ']';
    }
}
