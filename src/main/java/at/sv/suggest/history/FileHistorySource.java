package at.sv.suggest.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a history export stored as JSON file.
 */
@Slf4j
public final class FileHistorySource implements HistorySource {

    private final Path file;
    private final ObjectMapper mapper;

    public FileHistorySource(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public JsonNode fetchHistory() {
        log.debug("Read history from '{}'", file);
        try {
            return mapper.readTree(Files.readString(file));
        } catch (JsonProcessingException e) {
            throw new HistoryUnavailableException("Failed to parse history file '" + file + "': " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new HistoryUnavailableException("Failed to read history file '" + file + "': " + e.getLocalizedMessage(), e);
        }
    }
}
