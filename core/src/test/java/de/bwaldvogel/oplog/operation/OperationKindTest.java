package de.bwaldvogel.oplog.operation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import nl.jqno.equalsverifier.EqualsVerifier;

class OperationKindTest {

    @Test
    void testInsertEqualsHashCodeContract() throws Exception {
        EqualsVerifier.forClass(OperationKind.Insert.class)
            .usingGetClass()
            .verify();
    }

    @Test
    void testTypes() throws Exception {
        assertThat(OperationKind.NOOP.getType()).isEqualTo(OperationType.NOOP);
        assertThat(OperationKind.insert("foo.bar").getType()).isEqualTo(OperationType.INSERT);
        assertThat(OperationKind.UPDATE.getType()).isEqualTo(OperationType.UPDATE);
        assertThat(OperationKind.DELETE.getType()).isEqualTo(OperationType.DELETE);
        assertThat(OperationKind.COMMAND.getType()).isEqualTo(OperationType.COMMAND);
        assertThat(OperationKind.DATABASE.getType()).isEqualTo(OperationType.DATABASE);
    }

    @Test
    void testInsertsAreComparedByNamespace() throws Exception {
        assertThat(OperationKind.insert("foo.bar")).isEqualTo(OperationKind.insert("foo.bar"));
        assertThat(OperationKind.insert("foo.bar")).isNotEqualTo(OperationKind.insert("foo.baz"));
        assertThat(OperationKind.insert("foo.bar").getNamespace()).isEqualTo("foo.bar");
    }

    @Test
    void testKindsAreDistinct() throws Exception {
        assertThat(OperationKind.NOOP).isNotEqualTo(OperationKind.UPDATE);
        assertThat(OperationKind.UPDATE).isNotEqualTo(OperationKind.DELETE);
        assertThat(OperationKind.COMMAND).isNotEqualTo(OperationKind.DATABASE);
        assertThat(OperationKind.NOOP).isNotEqualTo(OperationKind.insert(""));
    }

    @Test
    void testToString() throws Exception {
        assertThat(OperationKind.NOOP).hasToString("NOOP");
        assertThat(OperationKind.insert("foo.bar")).hasToString("INSERT(namespace: foo.bar)");
    }

}
