package at.sv.suggest.mining;

import at.sv.suggest.history.EntityIds;
import at.sv.suggest.history.StateEvent;

public record SequenceStep(String entityId, String state, String domain) {

    public static SequenceStep of(String entityId, String state) {
        return new SequenceStep(entityId, state, EntityIds.getDomain(entityId));
    }

    static SequenceStep of(StateEvent event) {
        return new SequenceStep(event.entityId(), event.state(), event.domain());
    }

    boolean matches(StateEvent event) {
        return entityId.equals(event.entityId()) && state.equals(event.state());
    }
}
