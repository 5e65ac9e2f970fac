package at.sv.suggest;

import at.sv.suggest.automation.AutomationDocument;
import at.sv.suggest.automation.AutomationSynthesizer;
import at.sv.suggest.automation.AutomationTemplates;
import at.sv.suggest.automation.InvalidTemplateException;
import at.sv.suggest.automation.TemplateOptions;
import at.sv.suggest.automation.TemplateType;
import at.sv.suggest.history.FileHistorySource;
import at.sv.suggest.history.HistoryNormalizer;
import at.sv.suggest.history.HistorySource;
import at.sv.suggest.history.HistoryUnavailableException;
import at.sv.suggest.mining.PatternDiscovery;
import at.sv.suggest.mining.PatternType;
import at.sv.suggest.suggestion.Suggestion;
import at.sv.suggest.suggestion.SuggestionAssembler;
import at.sv.suggest.suggestion.SuggestionReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Command(name = "AutomationSuggester", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Analyzes a Home Assistant state history export and suggests automations for recurring patterns.")
public final class AutomationSuggester implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(AutomationSuggester.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(
            index = "0",
            arity = "0..1",
            paramLabel = "HISTORY_FILE",
            defaultValue = "${env:HISTORY_FILE}",
            description = "The JSON file containing the state history, either as list of entries with 'entity_id', " +
                          "as object of entity id to entries, or as returned by the Home Assistant history API.")
    Path historyFile;
    @Option(names = "--min-occurrences", paramLabel = "<count>",
            defaultValue = "${env:MIN_OCCURRENCES:-3}",
            description = "The minimum number of observations before a pattern is suggested. Default: ${DEFAULT-VALUE}")
    int minOccurrences;
    @Option(names = "--confidence-threshold", paramLabel = "<ratio>",
            defaultValue = "${env:CONFIDENCE_THRESHOLD:-0.7}",
            description = "The confidence [0..1] a pattern needs to be detected. Default: ${DEFAULT-VALUE}")
    double confidenceThreshold;
    @Option(names = "--min-confidence", paramLabel = "<ratio>",
            defaultValue = "${env:MIN_CONFIDENCE:-0.7}",
            description = "The confidence [0..1] a suggestion needs to be shown. Default: ${DEFAULT-VALUE}")
    double minConfidence;
    @Option(names = "--max-suggestions", paramLabel = "<count>",
            defaultValue = "${env:MAX_SUGGESTIONS:-5}",
            description = "The maximum number of suggestions to show. Default: ${DEFAULT-VALUE}")
    int maxSuggestions;
    @Option(names = "--sequence-window", paramLabel = "<seconds>",
            defaultValue = "${env:SEQUENCE_WINDOW:-120}",
            description = "The maximum duration of a sequence of state changes in seconds. Default: ${DEFAULT-VALUE}")
    long sequenceWindowInSeconds;
    @Option(names = "--condition-window", paramLabel = "<seconds>",
            defaultValue = "${env:CONDITION_WINDOW:-600}",
            description = "The maximum delay in seconds between a sensor change and a correlated device change. " +
                          "Default: ${DEFAULT-VALUE}")
    long conditionWindowInSeconds;
    @Option(names = "--time-zone", paramLabel = "<zone>",
            defaultValue = "${env:TIME_ZONE}",
            description = "The time zone used for weekday and hour detection, e.g. Europe/Vienna. " +
                          "If not set, the offset of each recorded timestamp is used.")
    String timeZone;
    @Option(names = "--entity", paramLabel = "<entity_id>",
            description = "Only show suggestions involving the given entity.")
    String entityFilter;
    @Option(names = "--category", paramLabel = "<category>",
            description = "Only show suggestions of the given category: daily, sequence, conditional, periodic.")
    String categoryFilter;
    @Option(names = "--format", paramLabel = "<format>",
            defaultValue = "${env:OUTPUT_FORMAT:-yaml}",
            description = "The output format: yaml prints the automations, json prints the full report. " +
                          "Default: ${DEFAULT-VALUE}")
    String format;
    @Option(names = "--parallel",
            defaultValue = "${env:PARALLEL:-false}",
            description = "Run the pattern miners in parallel. Default: ${DEFAULT-VALUE}")
    boolean parallel;
    @Option(names = "--timestamped-ids",
            defaultValue = "${env:TIMESTAMPED_IDS:-false}",
            description = "Use the creation time for automation ids instead of ids derived from the pattern. " +
                          "Default: ${DEFAULT-VALUE}")
    boolean timestampedIds;
    @Option(names = "--template", paramLabel = "<type>",
            description = "Create automations from a template instead of analyzing a history: time, state, sequence.")
    String template;
    @Option(names = "--template-entity", paramLabel = "<entity_id>", split = ",",
            description = "The entities controlled by the template automations. Repeatable or comma separated.")
    List<String> templateEntities;
    @Option(names = "--template-time", paramLabel = "<HH:mm>", defaultValue = "08:00",
            description = "The full hour of a time template. Default: ${DEFAULT-VALUE}")
    String templateTime;
    @Option(names = "--template-weekday", paramLabel = "<day>",
            description = "The weekday of a time template, e.g. Mo or Monday.")
    String templateWeekday;
    @Option(names = "--template-state", paramLabel = "<state>", defaultValue = "on",
            description = "The state to set by time and sequence templates. Default: ${DEFAULT-VALUE}")
    String templateState;
    @Option(names = "--template-trigger-entity", paramLabel = "<entity_id>",
            description = "The entity whose state change triggers a state template.")
    String templateTriggerEntity;
    @Option(names = "--template-trigger-state", paramLabel = "<state>",
            description = "The state that triggers a state template.")
    String templateTriggerState;
    @Option(names = "--template-action-state", paramLabel = "<state>", defaultValue = "on",
            description = "The state to set by a state template. Default: ${DEFAULT-VALUE}")
    String templateActionState;

    private final HistorySource historySource;
    private final ObjectMapper mapper;

    public AutomationSuggester() {
        this(null);
    }

    /**
     * @param historySource the source to read from, or null to read the given {@code HISTORY_FILE}
     */
    public AutomationSuggester(HistorySource historySource) {
        this.historySource = historySource;
        mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new AutomationSuggester()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public Integer call() {
        MDC.put("context", "init");
        try {
            assertConfigurationParameters();
            DiscoveryConfig config = createConfig();
            if (template != null) {
                MDC.put("context", "template");
                printAutomations(new AutomationSynthesizer(config), spec.commandLine().getOut());
                return 0;
            }
            JsonNode rawHistory;
            try {
                MDC.put("context", "history");
                rawHistory = getHistorySource().fetchHistory();
            } catch (HistoryUnavailableException e) {
                LOG.debug("Failed to load history", e);
                spec.commandLine().getErr().println(e.getLocalizedMessage());
                return 1;
            }
            MDC.put("context", "discovery");
            print(filter(suggest(config, rawHistory)), spec.commandLine().getOut());
            return 0;
        } finally {
            MDC.remove("context");
        }
    }

    private SuggestionReport suggest(DiscoveryConfig config, JsonNode rawHistory) {
        ExecutorService executor = parallel ? Executors.newFixedThreadPool(PatternType.values().length) : null;
        try {
            SuggestionAssembler assembler = new SuggestionAssembler(config,
                    new HistoryNormalizer(mapper, config.getTimeZone()), new PatternDiscovery(config, executor),
                    new AutomationSynthesizer(config));
            return assembler.suggest(rawHistory);
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
    }

    private void printAutomations(AutomationSynthesizer synthesizer, PrintWriter out) {
        List<AutomationDocument> automations = createFromTemplate(synthesizer);
        if ("json".equals(format)) {
            try {
                out.println(mapper.writeValueAsString(automations));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to write automations: " + e.getOriginalMessage(), e);
            }
        } else {
            for (AutomationDocument automation : automations) {
                out.println("# " + automation.getAlias());
                out.println(synthesizer.toYaml(automation));
            }
        }
        out.flush();
    }

    private List<AutomationDocument> createFromTemplate(AutomationSynthesizer synthesizer) {
        TemplateOptions options = TemplateOptions.builder()
                                                 .time(templateTime)
                                                 .weekday(templateWeekday)
                                                 .state(templateState)
                                                 .triggerEntity(templateTriggerEntity)
                                                 .triggerState(templateTriggerState)
                                                 .actionState(templateActionState)
                                                 .build();
        try {
            return new AutomationTemplates(synthesizer).create(TemplateType.fromName(template), templateEntities, options);
        } catch (InvalidTemplateException e) {
            fail("--template " + e.getMessage());
            return null;
        }
    }

    private HistorySource getHistorySource() {
        if (historySource != null) {
            return historySource;
        }
        return new FileHistorySource(historyFile, mapper);
    }

    private DiscoveryConfig createConfig() {
        try {
            return DiscoveryConfig.builder()
                                  .minOccurrences(minOccurrences)
                                  .confidenceThreshold(confidenceThreshold)
                                  .minConfidence(minConfidence)
                                  .maxSuggestions(maxSuggestions)
                                  .sequenceWindow(Duration.ofSeconds(sequenceWindowInSeconds))
                                  .conditionWindow(Duration.ofSeconds(conditionWindowInSeconds))
                                  .timeZone(parseTimeZone())
                                  .timestampedIds(timestampedIds)
                                  .build();
        } catch (InvalidConfigurationException e) {
            fail(e.getMessage());
            return null;
        }
    }

    private ZoneId parseTimeZone() {
        if (timeZone == null || timeZone.isBlank()) {
            return null;
        }
        try {
            return ZoneId.of(timeZone.trim());
        } catch (DateTimeException e) {
            fail("--time-zone '" + timeZone + "' is no valid time zone");
            return null;
        }
    }

    private SuggestionReport filter(SuggestionReport report) {
        List<Suggestion> suggestions = report.suggestions();
        if (entityFilter != null) {
            suggestions = SuggestionAssembler.filterByEntity(suggestions, entityFilter);
        }
        if (categoryFilter != null) {
            suggestions = SuggestionAssembler.categorize(suggestions).get(PatternType.fromCategory(categoryFilter).getCategory());
        }
        return new SuggestionReport(suggestions, SuggestionAssembler.categorize(suggestions), suggestions.size(),
                report.analyzedEntities());
    }

    private void print(SuggestionReport report, PrintWriter out) {
        if ("json".equals(format)) {
            try {
                out.println(mapper.writeValueAsString(report));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to write report: " + e.getOriginalMessage(), e);
            }
        } else if (report.suggestions().isEmpty()) {
            out.println("# No suggestions found in the history of " + report.analyzedEntities() + " entities.");
        } else {
            for (Suggestion suggestion : report.suggestions()) {
                out.println("# " + suggestion.getTitle() + " (" + FormatUtil.formatPercent(suggestion.getConfidence()) + ")");
                out.println(suggestion.getYaml());
            }
        }
        out.flush();
    }

    private void assertConfigurationParameters() {
        if (template == null && historySource == null && historyFile == null) {
            fail("HISTORY_FILE is required");
        }
        if (!"yaml".equals(format) && !"json".equals(format)) {
            fail("--format must be either yaml or json");
        }
        if (categoryFilter != null) {
            try {
                PatternType.fromCategory(categoryFilter);
            } catch (IllegalArgumentException e) {
                fail("--category " + e.getMessage());
            }
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
