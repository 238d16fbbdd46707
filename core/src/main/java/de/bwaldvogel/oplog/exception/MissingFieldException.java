package de.bwaldvogel.oplog.exception;

/**
 * A required field of an oplog entry is absent, {@code null} or of the wrong BSON type.
 */
public class MissingFieldException extends OplogDecodeException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;
    private final String expectedType;
    private final String actualType;

    private MissingFieldException(String message, String fieldName, String expectedType, String actualType) {
        super(message);
        this.fieldName = fieldName;
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public static MissingFieldException absent(String fieldName, String expectedType) {
        return new MissingFieldException("Field '" + fieldName + "' is missing, expected " + expectedType,
            fieldName, expectedType, null);
    }

    public static MissingFieldException wrongType(String fieldName, String expectedType, Class<?> actualType) {
        String actualTypeName = actualType.getSimpleName();
        return new MissingFieldException("Field '" + fieldName + "' has type " + actualTypeName + ", expected " + expectedType,
            fieldName, expectedType, actualTypeName);
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getExpectedType() {
        return expectedType;
    }

    public boolean isAbsent() {
        return actualType == null;
    }

}
