package at.sv.suggest;

import at.sv.suggest.history.HistorySource;
import at.sv.suggest.history.HistoryUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AutomationSuggesterTest {

    private static final String DAILY_HISTORY = """
            [
              {"entity_id": "light.living_room", "state": "on", "last_changed": "2024-01-01T07:02:00Z"},
              {"entity_id": "light.living_room", "state": "on", "last_changed": "2024-01-08T07:05:00Z"},
              {"entity_id": "light.living_room", "state": "on", "last_changed": "2024-01-15T07:01:00Z"},
              {"entity_id": "switch.pump", "state": "on", "last_changed": "2024-02-01T00:00:00Z"},
              {"entity_id": "switch.pump", "state": "on", "last_changed": "2024-02-01T02:00:00Z"},
              {"entity_id": "switch.pump", "state": "on", "last_changed": "2024-02-01T04:00:00Z"},
              {"entity_id": "switch.pump", "state": "on", "last_changed": "2024-02-01T06:00:00Z"},
              {"entity_id": "switch.pump", "state": "on", "last_changed": "2024-02-01T08:00:00Z"},
              {"entity_id": "switch.pump", "state": "on", "last_changed": "2024-02-01T10:00:00Z"}
            ]
            """;

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int execute(AutomationSuggester suggester, String... args) {
        CommandLine commandLine = new CommandLine(suggester);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private Path writeHistory(String json) throws IOException {
        Path file = tempDir.resolve("history.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    void historyFile_printsAutomationYaml() throws IOException {
        Path file = writeHistory(DAILY_HISTORY);

        int exitCode = execute(new AutomationSuggester(), file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("# Turn on light.living_room every Monday at 07:00 (100%)",
                "# Turn on switch.pump every 2 hours (100%)", "light.turn_on", "switch.turn_on", "07:00:00");
    }

    @Test
    void categoryFilter_onlyMatchingSuggestions() throws IOException {
        Path file = writeHistory(DAILY_HISTORY);

        int exitCode = execute(new AutomationSuggester(), file.toString(), "--category", "periodic");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("switch.pump").doesNotContain("light.living_room");
    }

    @Test
    void entityFilter_onlyMatchingSuggestions() throws IOException {
        Path file = writeHistory(DAILY_HISTORY);

        int exitCode = execute(new AutomationSuggester(), file.toString(), "--entity", "light.living_room");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("light.living_room").doesNotContain("switch.pump");
    }

    @Test
    void jsonFormat_printsReport() throws Exception {
        Path file = writeHistory(DAILY_HISTORY);

        int exitCode = execute(new AutomationSuggester(), file.toString(), "--format", "json", "--parallel");

        assertThat(exitCode).isZero();
        JsonNode report = new ObjectMapper().readTree(out.toString());
        assertThat(report.get("count").asInt()).isEqualTo(2);
        assertThat(report.get("analyzed_entities").asInt()).isEqualTo(2);
        assertThat(report.get("suggestions").get(0).get("type").asText()).isEqualTo("daily");
        assertThat(report.get("suggestions").get(0).get("pattern").get("type").asText()).isEqualTo("daily");
        assertThat(report.get("categories").get("periodic").size()).isEqualTo(1);
    }

    @Test
    void maxSuggestions_limitsOutput() throws IOException {
        Path file = writeHistory(DAILY_HISTORY);

        int exitCode = execute(new AutomationSuggester(), file.toString(), "--max-suggestions", "1");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("light.living_room").doesNotContain("switch.pump");
    }

    @Test
    void noPatterns_printsHint() throws IOException {
        Path file = writeHistory("""
                [{"entity_id": "light.a", "state": "on", "last_changed": "2024-01-01T07:00:00Z"}]
                """);

        int exitCode = execute(new AutomationSuggester(), file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("# No suggestions found in the history of 1 entities.");
    }

    @Test
    void missingFile_exitCodeOne() {
        int exitCode = execute(new AutomationSuggester(), tempDir.resolve("missing.json").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Failed to read history file");
    }

    @Test
    void historySource_unavailable_exitCodeOne() {
        HistorySource source = mock(HistorySource.class);
        when(source.fetchHistory()).thenThrow(new HistoryUnavailableException("Connection refused", null));

        int exitCode = execute(new AutomationSuggester(source));

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Connection refused");
    }

    @Test
    void historySource_usedInsteadOfFile() throws Exception {
        HistorySource source = mock(HistorySource.class);
        when(source.fetchHistory()).thenReturn(new ObjectMapper().readTree(DAILY_HISTORY));

        int exitCode = execute(new AutomationSuggester(source), "--min-confidence", "1.0");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("light.living_room", "switch.pump");
    }

    @Test
    void noHistoryFile_usageError() {
        int exitCode = execute(new AutomationSuggester());

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("HISTORY_FILE is required");
    }

    @Test
    void invalidConfidence_usageError() throws IOException {
        Path file = writeHistory(DAILY_HISTORY);

        int exitCode = execute(new AutomationSuggester(), file.toString(), "--min-confidence", "1.5");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("min confidence");
    }

    @Test
    void invalidCategory_usageError() throws IOException {
        Path file = writeHistory(DAILY_HISTORY);

        int exitCode = execute(new AutomationSuggester(), file.toString(), "--category", "weekly");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Unknown pattern category 'weekly'");
    }

    @Test
    void invalidTimeZone_usageError() throws IOException {
        Path file = writeHistory(DAILY_HISTORY);

        int exitCode = execute(new AutomationSuggester(), file.toString(), "--time-zone", "Mars/Olympus");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("no valid time zone");
    }

    @Test
    void timeZone_shiftsDailyHour() throws IOException {
        Path file = writeHistory(DAILY_HISTORY);

        int exitCode = execute(new AutomationSuggester(), file.toString(), "--time-zone", "Europe/Vienna",
                "--category", "daily");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("every Monday at 08:00", "08:00:00");
    }

    @Test
    void timeTemplate_withoutHistory_printsAutomationPerEntity() {
        int exitCode = execute(new AutomationSuggester(), "--template", "time", "--template-entity", "light.a,switch.b",
                "--template-weekday", "Tu", "--template-time", "21:00", "--template-state", "off");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("# Turn off light.a on Tuesday at 21:00", "daily_light_a_1_21",
                "daily_switch_b_1_21", "21:00:00", "switch.turn_off");
    }

    @Test
    void stateTemplate_json_printsAutomations() throws Exception {
        int exitCode = execute(new AutomationSuggester(), "--template", "state", "--template-entity", "light.hall",
                "--template-trigger-entity", "binary_sensor.door", "--template-trigger-state", "on", "--format", "json");

        assertThat(exitCode).isZero();
        JsonNode automations = new ObjectMapper().readTree(out.toString());
        assertThat(automations.size()).isEqualTo(1);
        assertThat(automations.get(0).get("id").asText()).isEqualTo("condition_light_hall_binary_sensor_door");
        assertThat(automations.get(0).get("trigger").get(0).get("entity_id").asText()).isEqualTo("binary_sensor.door");
    }

    @Test
    void sequenceTemplate_tooFewEntities_usageError() {
        int exitCode = execute(new AutomationSuggester(), "--template", "sequence", "--template-entity", "light.a",
                "--template-entity", "light.b");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("at least 3");
    }

    @Test
    void unknownTemplate_usageError() {
        int exitCode = execute(new AutomationSuggester(), "--template", "weekly", "--template-entity", "light.a");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Unknown template type 'weekly'");
    }
}
