package at.sv.suggest.automation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * What starts an automation. Only the fields of the respective platform are set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"platform", "at", "weekday", "entity_id", "to", "hours", "domain", "device_id", "type", "subtype"})
public final class Trigger {
    String platform;
    String at;
    /**
     * Weekdays starting with 1 for Monday.
     */
    List<Integer> weekday;
    String entity_id;
    String to;
    String hours;
    String domain;
    String device_id;
    String type;
    String subtype;

    public static Trigger time(String at, List<Integer> weekday) {
        return builder().platform("time").at(at).weekday(weekday).build();
    }

    public static Trigger state(String entityId, String to) {
        return builder().platform("state").entity_id(entityId).to(to).build();
    }

    public static Trigger timePattern(String hours) {
        return builder().platform("time_pattern").hours(hours).build();
    }

    /**
     * A device trigger without device, to be replaced by the user.
     */
    public static Trigger placeholderButton() {
        return builder().platform("device")
                        .domain("mqtt")
                        .device_id("")
                        .type("button_short_press")
                        .subtype("1")
                        .build();
    }
}
