package at.sv.suggest.suggestion;

import java.util.List;
import java.util.Map;

/**
 * The result of one suggestion run.
 *
 * @param categories    the suggestions grouped by type, all categories are present
 * @param analyzedEntities the number of entities with usable history
 */
public record SuggestionReport(List<Suggestion> suggestions, Map<String, List<Suggestion>> categories,
                               int count, int analyzedEntities) {
}
