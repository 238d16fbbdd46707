package de.bwaldvogel.oplog.exception;

public class BsonDecodeException extends OplogException {

    private static final long serialVersionUID = 1L;

    public BsonDecodeException(String message) {
        super(message);
    }

    public BsonDecodeException(String message, Throwable cause) {
        super(message, cause);
    }

}
