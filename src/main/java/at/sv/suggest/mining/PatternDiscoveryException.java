package at.sv.suggest.mining;

/**
 * Signals that a mining pass failed or was interrupted.
 */
public final class PatternDiscoveryException extends RuntimeException {

    public PatternDiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
