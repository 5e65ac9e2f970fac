package at.sv.suggest.suggestion;

import at.sv.suggest.DiscoveryConfig;
import at.sv.suggest.FormatUtil;
import at.sv.suggest.automation.AutomationDocument;
import at.sv.suggest.automation.AutomationSynthesizer;
import at.sv.suggest.history.EntityHistory;
import at.sv.suggest.history.HistoryNormalizer;
import at.sv.suggest.mining.ConditionalPattern;
import at.sv.suggest.mining.DailyPattern;
import at.sv.suggest.mining.Pattern;
import at.sv.suggest.mining.PatternDiscovery;
import at.sv.suggest.mining.PatternType;
import at.sv.suggest.mining.PeriodicPattern;
import at.sv.suggest.mining.SequencePattern;
import at.sv.suggest.mining.SequenceStep;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns discovered patterns into ranked suggestions. Suggestions are ordered by confidence, highest first; equal
 * confidences keep the miner order daily, sequence, conditional, periodic.
 */
@Slf4j
public final class SuggestionAssembler {

    private final DiscoveryConfig config;
    private final HistoryNormalizer normalizer;
    private final PatternDiscovery discovery;
    private final AutomationSynthesizer synthesizer;

    public SuggestionAssembler(DiscoveryConfig config) {
        this(config, new HistoryNormalizer(config.getTimeZone()), new PatternDiscovery(config),
                new AutomationSynthesizer(config));
    }

    public SuggestionAssembler(DiscoveryConfig config, HistoryNormalizer normalizer, PatternDiscovery discovery,
                               AutomationSynthesizer synthesizer) {
        this.config = config;
        this.normalizer = normalizer;
        this.discovery = discovery;
        this.synthesizer = synthesizer;
    }

    /**
     * Normalizes the raw history, generates the suggestions and groups them by category.
     */
    public SuggestionReport suggest(Object rawHistory) {
        Map<String, EntityHistory> histories = normalizer.normalize(rawHistory);
        List<Suggestion> suggestions = generateSuggestions(histories);
        return new SuggestionReport(suggestions, categorize(suggestions), suggestions.size(), histories.size());
    }

    public List<Suggestion> generateSuggestions(Map<String, EntityHistory> histories) {
        List<Suggestion> suggestions = toSuggestions(discovery.discover(histories));
        List<Suggestion> ranked = suggestions.stream()
                                             .sorted(Comparator.comparingDouble(Suggestion::getConfidence).reversed())
                                             .filter(suggestion -> suggestion.getConfidence() >= config.getMinConfidence())
                                             .limit(config.getMaxSuggestions())
                                             .collect(Collectors.toList());
        log.info("Created {} of {} possible suggestions for {} entities.", ranked.size(), suggestions.size(),
                histories.size());
        return Collections.unmodifiableList(ranked);
    }

    public List<Suggestion> toSuggestions(List<Pattern> patterns) {
        List<Suggestion> suggestions = new ArrayList<>();
        patterns.forEach(pattern -> suggestions.add(toSuggestion(pattern)));
        return suggestions;
    }

    public Suggestion toSuggestion(Pattern pattern) {
        AutomationDocument automation = synthesizer.synthesize(pattern);
        String confidence = FormatUtil.formatPercent(pattern.confidence());
        Suggestion.SuggestionBuilder suggestion = Suggestion.builder()
                                                            .id(automation.getId())
                                                            .type(pattern.type())
                                                            .confidence(pattern.confidence())
                                                            .entities(pattern.entityIds())
                                                            .pattern(pattern)
                                                            .config(automation)
                                                            .yaml(synthesizer.toYaml(automation));
        if (pattern instanceof DailyPattern daily) {
            String when = FormatUtil.formatDayOfWeek(daily.dayOfWeek()) + " at " + FormatUtil.formatHour(daily.hour());
            suggestion.title("Turn " + daily.state() + " " + daily.entityId() + " every " + when)
                      .description("This automation will turn " + daily.state() + " the " + daily.entityId() +
                                   " every " + when + ". This pattern was detected with " + confidence + " confidence.");
        } else if (pattern instanceof SequencePattern sequence) {
            List<SequenceStep> steps = sequence.steps();
            String others = steps.stream().skip(1).map(SequenceStep::entityId).collect(Collectors.joining(", "));
            suggestion.title("Create a scene with " + steps.size() + " devices")
                      .description("This automation will create a scene that sets " + steps.size() +
                                   " devices to specific states. The scene starts with " +
                                   sequence.firstStep().entityId() + " and includes " + others +
                                   ". This pattern was detected with " + confidence + " confidence.");
        } else if (pattern instanceof ConditionalPattern conditional) {
            suggestion.title("Turn " + conditional.targetState() + " " + conditional.entityId() + " when " +
                             conditional.conditionEntity() + " is " + conditional.conditionState())
                      .description("This automation will turn " + conditional.targetState() + " the " +
                                   conditional.entityId() + " when " + conditional.conditionEntity() +
                                   " changes to " + conditional.conditionState() +
                                   ". This pattern was detected with " + confidence + " confidence.");
        } else if (pattern instanceof PeriodicPattern periodic) {
            String interval = FormatUtil.formatHours(periodic.intervalHours());
            suggestion.title("Turn " + periodic.state() + " " + periodic.entityId() + " every " + interval + " hours")
                      .description("This automation will turn " + periodic.state() + " the " + periodic.entityId() +
                                   " every " + interval + " hours. This pattern was detected with " + confidence +
                                   " confidence.");
        }
        return suggestion.build();
    }

    /**
     * Groups the suggestions by type. The result always contains the categories daily, conditional, sequence and
     * periodic, in this order.
     */
    public static Map<String, List<Suggestion>> categorize(List<Suggestion> suggestions) {
        Map<String, List<Suggestion>> categories = new LinkedHashMap<>();
        for (PatternType type : List.of(PatternType.DAILY, PatternType.CONDITIONAL, PatternType.SEQUENCE,
                PatternType.PERIODIC)) {
            categories.put(type.getCategory(), new ArrayList<>());
        }
        suggestions.forEach(suggestion -> categories.get(suggestion.getType().getCategory()).add(suggestion));
        return categories;
    }

    public static List<Suggestion> filterByEntity(List<Suggestion> suggestions, String entityId) {
        return suggestions.stream()
                          .filter(suggestion -> suggestion.involves(entityId))
                          .collect(Collectors.toList());
    }

    public static Optional<Suggestion> findById(List<Suggestion> suggestions, String suggestionId) {
        return suggestions.stream()
                          .filter(suggestion -> suggestion.getId().equals(suggestionId))
                          .findFirst();
    }
}
