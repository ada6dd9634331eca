package de.bsommerfeld.pseat.db;

/**
 * The store could not be opened, read or written. The underlying
 * {@link java.sql.SQLException} or {@link java.io.IOException} is kept as the
 * cause. Never retried by the store itself.
 */
public class StorageUnavailableException extends RulesStoreException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
