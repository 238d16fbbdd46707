package de.bwaldvogel.oplog.operation;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public enum OperationType {
    NOOP("n", true),
    INSERT("i", true),
    UPDATE("u", false),
    DELETE("d", false),
    COMMAND("c", false),
    DATABASE("db", false);

    private final String code;
    private final boolean decodable;

    OperationType(String code, boolean decodable) {
        this.code = code;
        this.decodable = decodable;
    }

    public String getCode() {
        return code;
    }

    /**
     * Whether {@link OperationDecoder} turns entries of this type into operations.
     * Entries of the other types are rejected with an {@code UnknownOperationException}.
     */
    public boolean isDecodable() {
        return decodable;
    }

    private static final Map<String, OperationType> MAP = new HashMap<>();

    static {
        for (OperationType operationType : OperationType.values()) {
            OperationType old = MAP.put(operationType.getCode(), operationType);
            if (old != null) {
                throw new IllegalStateException("Duplicate operation type code: " + operationType.getCode());
            }
        }
    }

    public static Optional<OperationType> fromCode(String code) {
        return Optional.ofNullable(MAP.get(code));
    }
}
