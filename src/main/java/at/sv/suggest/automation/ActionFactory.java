package at.sv.suggest.automation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps a desired entity state to the service call reaching it.
 */
public final class ActionFactory {

    private ActionFactory() {
    }

    public static Action createAction(String entityId, String domain, String state) {
        if (ToggleableDomain.isToggleable(domain)) {
            String service = "on".equals(state) ? "turn_on" : "turn_off";
            return new Action(domain + "." + service, new ActionTarget(entityId), null);
        }
        if ("climate".equals(domain)) {
            return new Action("climate.set_hvac_mode", new ActionTarget(entityId), data("hvac_mode", state));
        }
        return new Action(domain + ".set_state", new ActionTarget(entityId), data("state", state));
    }

    private static Map<String, String> data(String key, String value) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put(key, value);
        return data;
    }
}
