package at.sv.suggest.automation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts automations from and to the YAML of the Home Assistant configuration. When reading, trigger, condition
 * and action may each be given as single object or as list; they are always returned as lists.
 */
public final class AutomationYaml {

    private final ObjectMapper mapper;

    public AutomationYaml() {
        mapper = new ObjectMapper(YAMLFactory.builder()
                                             .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                                             .build());
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);
    }

    public String write(AutomationDocument automation) {
        try {
            return mapper.writeValueAsString(automation);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write automation '" + automation.getId() + "'", e);
        }
    }

    public AutomationDocument read(String yaml) {
        AutomationDocument automation;
        try {
            automation = mapper.readValue(yaml, AutomationDocument.class);
        } catch (JsonProcessingException e) {
            throw new InvalidAutomationException("Failed to parse automation: " + e.getOriginalMessage(), e);
        }
        if (automation == null) {
            throw new InvalidAutomationException("Empty automation");
        }
        assertNotEmpty(automation.getTrigger(), "trigger", automation);
        assertNotEmpty(automation.getAction(), "action", automation);
        if (automation.getCondition() == null) {
            automation.setCondition(new ArrayList<>());
        }
        return automation;
    }

    private static void assertNotEmpty(List<?> list, String property, AutomationDocument automation) {
        if (list == null || list.isEmpty()) {
            throw new InvalidAutomationException("Automation '" + automation.getId() + "' has no " + property);
        }
    }
}
