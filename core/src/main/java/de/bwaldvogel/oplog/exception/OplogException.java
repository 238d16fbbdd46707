package de.bwaldvogel.oplog.exception;

public class OplogException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public OplogException(String message) {
        super(validateMessage(message));
    }

    public OplogException(String message, Throwable cause) {
        super(validateMessage(message), cause);
    }

    private static String validateMessage(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("Illegal error message");
        }
        return message;
    }

}
