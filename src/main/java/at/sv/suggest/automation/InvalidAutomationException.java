package at.sv.suggest.automation;

/**
 * Signals automation YAML that can't be parsed, or that lacks a trigger or action.
 */
public final class InvalidAutomationException extends RuntimeException {

    public InvalidAutomationException(String message) {
        super(message);
    }

    public InvalidAutomationException(String message, Throwable cause) {
        super(message, cause);
    }
}
