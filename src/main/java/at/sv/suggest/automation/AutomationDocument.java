package at.sv.suggest.automation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * A Home Assistant automation. Trigger and action are non-empty lists, condition may be empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "alias", "description", "mode", "trigger", "condition", "action"})
public final class AutomationDocument {

    public static final String MODE_SINGLE = "single";

    String id;
    String alias;
    String description;
    String mode;
    List<Trigger> trigger;
    List<Map<String, Object>> condition;
    List<Action> action;
}
