package de.bwaldvogel.oplog.exception;

/**
 * A single oplog entry could not be turned into an operation. Terminal for that entry; retrying will not help.
 */
public abstract class OplogDecodeException extends OplogException {

    private static final long serialVersionUID = 1L;

    protected OplogDecodeException(String message) {
        super(message);
    }

}
