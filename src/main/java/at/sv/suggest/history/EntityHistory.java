package at.sv.suggest.history;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * The ordered events of one entity. Timestamps are non-decreasing.
 */
public record EntityHistory(String entityId, List<StateEvent> events) {

    public EntityHistory {
        events = List.copyOf(events);
        for (int i = 1; i < events.size(); i++) {
            ZonedDateTime previous = events.get(i - 1).timestamp();
            if (events.get(i).timestamp().isBefore(previous)) {
                throw new IllegalArgumentException("Events of '" + entityId + "' are not ordered by timestamp");
            }
        }
    }

    public String domain() {
        return EntityIds.getDomain(entityId);
    }

    public int size() {
        return events.size();
    }

    public boolean hasAtLeast(int count) {
        return events.size() >= count;
    }
}
