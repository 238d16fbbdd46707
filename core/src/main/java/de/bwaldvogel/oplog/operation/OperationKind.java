package de.bwaldvogel.oplog.operation;

import java.util.Objects;

/**
 * The category of an oplog operation together with its category specific data.
 * <p>
 * The set of kinds is closed. {@link OperationDecoder} only ever produces {@link #NOOP} and {@link Insert};
 * {@link #UPDATE}, {@link #DELETE}, {@link #COMMAND} and {@link #DATABASE} name categories of the oplog
 * that are recognized but not decoded.
 */
public abstract class OperationKind {

    public static final OperationKind UPDATE = new Simple(OperationType.UPDATE);
    public static final OperationKind DELETE = new Simple(OperationType.DELETE);
    public static final OperationKind COMMAND = new Simple(OperationType.COMMAND);
    public static final OperationKind DATABASE = new Simple(OperationType.DATABASE);
    public static final OperationKind NOOP = new Simple(OperationType.NOOP);

    private OperationKind() {
    }

    public static Insert insert(String namespace) {
        return new Insert(namespace);
    }

    public abstract OperationType getType();

    private static final class Simple extends OperationKind {

        private final OperationType type;

        private Simple(OperationType type) {
            this.type = type;
        }

        @Override
        public OperationType getType() {
            return type;
        }

        @Override
        public String toString() {
            return type.name();
        }
    }

    public static final class Insert extends OperationKind {

        private final String namespace;

        private Insert(String namespace) {
            this.namespace = Objects.requireNonNull(namespace);
        }

        @Override
        public OperationType getType() {
            return OperationType.INSERT;
        }

        public String getNamespace() {
            return namespace;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return Objects.equals(namespace, ((Insert) o).namespace);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(namespace);
        }

        @Override
        public String toString() {
            return "INSERT(namespace: " + namespace + ")";
        }
    }

}
