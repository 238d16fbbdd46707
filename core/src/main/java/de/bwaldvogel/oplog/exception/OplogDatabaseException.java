package de.bwaldvogel.oplog.exception;

/**
 * The underlying store failed: the tailing cursor could not be opened or kept failing while tailing.
 */
public class OplogDatabaseException extends OplogException {

    private static final long serialVersionUID = 1L;

    public OplogDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }

}
