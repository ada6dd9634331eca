package de.bsommerfeld.pseat.db;

/**
 * A caller handed a malformed record to {@link RulesRepository}. This is a
 * programming error on the caller's side, not a storage problem.
 */
public class InvalidRecordException extends RulesStoreException {

    public InvalidRecordException(String message) {
        super(message);
    }
}
