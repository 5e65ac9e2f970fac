package at.sv.suggest;

/**
 * Signals a discovery configuration value outside its allowed range.
 */
public final class InvalidConfigurationException extends RuntimeException {
    public InvalidConfigurationException(String message) {
        super(message);
    }
}
