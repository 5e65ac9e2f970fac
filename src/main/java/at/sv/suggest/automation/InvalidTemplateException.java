package at.sv.suggest.automation;

/**
 * Signals an unknown template type or missing and invalid template options.
 */
public final class InvalidTemplateException extends RuntimeException {
    public InvalidTemplateException(String message) {
        super(message);
    }
}
