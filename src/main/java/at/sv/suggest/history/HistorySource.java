package at.sv.suggest.history;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Supplies the raw state history to analyze. Implementations are expected to have retrieved all data before
 * returning, discovery does not start on partial results.
 */
public interface HistorySource {

    /**
     * @return the raw history in one of the shapes understood by {@link HistoryNormalizer}
     * @throws HistoryUnavailableException if the history could not be retrieved
     */
    JsonNode fetchHistory();
}
