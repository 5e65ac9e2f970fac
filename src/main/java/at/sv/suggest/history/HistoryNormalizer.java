package at.sv.suggest.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups raw history entries into {@link EntityHistory entity histories}. Supported shapes:
 * <ul>
 *     <li>a flat list of entries, each carrying an {@code entity_id}</li>
 *     <li>an object mapping entity ids to their list of entries</li>
 *     <li>a list of per-entity lists, as returned by the Home Assistant history API</li>
 * </ul>
 * Entries without {@code state} or {@code last_changed}, or with an unparsable timestamp, are skipped.
 */
@Slf4j
public final class HistoryNormalizer {

    private final ObjectMapper mapper;
    private final ZoneId timeZone;

    public HistoryNormalizer(ZoneId timeZone) {
        this(new ObjectMapper(), timeZone);
    }

    public HistoryNormalizer(ObjectMapper mapper, ZoneId timeZone) {
        this.mapper = mapper;
        this.timeZone = timeZone;
    }

    /**
     * Normalizes any object convertible to a JSON tree, e.g. lists and maps as produced by a JSON parser.
     */
    public Map<String, EntityHistory> normalize(Object raw) {
        if (raw instanceof JsonNode) {
            return normalize((JsonNode) raw);
        }
        if (raw == null) {
            log.warn("No history data provided.");
            return Collections.emptyMap();
        }
        JsonNode tree;
        try {
            tree = mapper.valueToTree(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Unsupported history data format: {}", raw.getClass().getName());
            return Collections.emptyMap();
        }
        return normalize(tree);
    }

    public Map<String, EntityHistory> normalize(JsonNode raw) {
        Map<String, List<StateEvent>> grouped = new LinkedHashMap<>();
        if (raw == null || raw.isMissingNode() || raw.isNull()) {
            log.warn("No history data provided.");
            return Collections.emptyMap();
        } else if (raw.isArray()) {
            for (JsonNode element : raw) {
                if (element.isArray()) {
                    element.forEach(entry -> addEntry(grouped, entry, null));
                } else {
                    addEntry(grouped, element, null);
                }
            }
        } else if (raw.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isArray()) {
                    log.debug("Skip history of '{}': expected a list of entries.", field.getKey());
                    continue;
                }
                field.getValue().forEach(entry -> addEntry(grouped, entry, field.getKey()));
            }
        } else {
            log.warn("Unsupported history data format: {}", raw.getNodeType());
            return Collections.emptyMap();
        }
        Map<String, EntityHistory> result = new LinkedHashMap<>();
        grouped.forEach((entityId, events) -> {
            events.sort(Comparator.comparing(event -> event.timestamp().toInstant())); // stable
            result.put(entityId, new EntityHistory(entityId, events));
        });
        log.debug("Normalized history of {} entities.", result.size());
        return Collections.unmodifiableMap(result);
    }

    private void addEntry(Map<String, List<StateEvent>> grouped, JsonNode entry, String groupEntityId) {
        if (!entry.isObject()) {
            log.debug("Skip history entry '{}': not an object.", entry);
            return;
        }
        String entityId = groupEntityId != null ? groupEntityId : getText(entry, "entity_id");
        String state = getText(entry, "state");
        String lastChanged = getText(entry, "last_changed");
        if (entityId == null || state == null || lastChanged == null) {
            log.debug("Skip incomplete history entry '{}'.", entry);
            return;
        }
        ZonedDateTime timestamp;
        try {
            timestamp = parseTimestamp(lastChanged, timeZone);
        } catch (DateTimeParseException e) {
            log.debug("Skip history entry with invalid timestamp '{}': {}", lastChanged, e.getLocalizedMessage());
            return;
        }
        grouped.computeIfAbsent(entityId, id -> new ArrayList<>()).add(new StateEvent(entityId, timestamp, state));
    }

    private static String getText(JsonNode entry, String field) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    /**
     * Parses an ISO-8601 timestamp. A trailing {@code Z} is read as UTC, a space instead of the {@code T} separator
     * is accepted. Timestamps without an offset are placed into the given zone, or UTC if none is given. If a zone
     * is given, the result is converted into it.
     *
     * @throws DateTimeParseException if the value is no ISO-8601 date time
     */
    public static ZonedDateTime parseTimestamp(String value, ZoneId timeZone) {
        String text = value.trim();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        if (text.endsWith("Z") || text.endsWith("z")) {
            text = text.substring(0, text.length() - 1) + "+00:00";
        }
        ZonedDateTime timestamp;
        try {
            timestamp = OffsetDateTime.parse(text).toZonedDateTime();
        } catch (DateTimeParseException e) {
            LocalDateTime local = LocalDateTime.parse(text);
            return local.atZone(timeZone != null ? timeZone : ZoneOffset.UTC);
        }
        if (timeZone != null) {
            return timestamp.withZoneSameInstant(timeZone);
        }
        return timestamp;
    }
}
