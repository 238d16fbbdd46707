package de.bwaldvogel.oplog.exception;

public class UnknownOperationException extends OplogDecodeException {

    private static final long serialVersionUID = 1L;

    private final String operationCode;

    public UnknownOperationException(String operationCode) {
        super("Unknown operation: '" + operationCode + "'");
        this.operationCode = operationCode;
    }

    public String getOperationCode() {
        return operationCode;
    }

}
