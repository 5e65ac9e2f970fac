package at.sv.suggest.history;

/**
 * Signals that the history could not be retrieved from its source.
 */
public final class HistoryUnavailableException extends RuntimeException {

    public HistoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
