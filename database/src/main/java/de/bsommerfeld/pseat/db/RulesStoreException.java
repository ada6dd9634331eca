package de.bsommerfeld.pseat.db;

/**
 * Base type of every failure the rules store reports. Unchecked, so command
 * handlers only catch it where they can turn it into an operator alert.
 */
public class RulesStoreException extends RuntimeException {

    public RulesStoreException(String message) {
        super(message);
    }

    public RulesStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
