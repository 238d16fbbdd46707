package de.bwaldvogel.oplog.bson;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import de.bwaldvogel.oplog.exception.MissingFieldException;

class DocumentTest {

    @Test
    void testTypedGetters() throws Exception {
        Document nested = new Document("msg", "initiating set");
        BsonTimestamp timestamp = new BsonTimestamp(1479419535, 1);
        Document document = new Document("op", "n")
            .append("h", -2135725856567446411L)
            .append("ts", timestamp)
            .append("o", nested);

        assertThat(document.getString("op")).isEqualTo("n");
        assertThat(document.getLong("h")).isEqualTo(-2135725856567446411L);
        assertThat(document.getTimestamp("ts")).isEqualTo(timestamp);
        assertThat(document.getDocument("o")).isSameAs(nested);
    }

    @Test
    void testMissingField() throws Exception {
        Document document = new Document("op", "n");

        assertThatExceptionOfType(MissingFieldException.class)
            .isThrownBy(() -> document.getLong("h"))
            .withMessage("Field 'h' is missing, expected int64")
            .satisfies(e -> {
                assertThat(e.getFieldName()).isEqualTo("h");
                assertThat(e.getExpectedType()).isEqualTo("int64");
                assertThat(e.isAbsent()).isTrue();
            });
    }

    @Test
    void testNullValueCountsAsMissing() throws Exception {
        Document document = new Document("ns", null);

        assertThatExceptionOfType(MissingFieldException.class)
            .isThrownBy(() -> document.getString("ns"))
            .withMessage("Field 'ns' is missing, expected string");
    }

    @Test
    void testWrongType() throws Exception {
        Document document = new Document("h", 42)
            .append("ts", 1234L)
            .append("o", "not a document")
            .append("op", 1);

        assertThatExceptionOfType(MissingFieldException.class)
            .isThrownBy(() -> document.getLong("h"))
            .withMessage("Field 'h' has type Integer, expected int64")
            .satisfies(e -> assertThat(e.isAbsent()).isFalse());

        assertThatExceptionOfType(MissingFieldException.class)
            .isThrownBy(() -> document.getTimestamp("ts"))
            .withMessage("Field 'ts' has type Long, expected timestamp");

        assertThatExceptionOfType(MissingFieldException.class)
            .isThrownBy(() -> document.getDocument("o"))
            .withMessage("Field 'o' has type String, expected document");

        assertThatExceptionOfType(MissingFieldException.class)
            .isThrownBy(() -> document.getString("op"))
            .withMessage("Field 'op' has type Integer, expected string");
    }

    @Test
    void testKeysAreCaseSensitive() throws Exception {
        Document document = new Document("OP", "n");

        assertThatExceptionOfType(MissingFieldException.class)
            .isThrownBy(() -> document.getString("op"));
    }

    @Test
    void testEqualsIgnoresKeyOrder() throws Exception {
        Document document = new Document("a", 1).append("b", 2);
        assertThat(document).isEqualTo(new Document("a", 1).append("b", 2));
        assertThat(document).isEqualTo(new Document("b", 2).append("a", 1));
        assertThat(document).isNotEqualTo(new Document("a", 1L).append("b", 2));
        assertThat(document.hashCode()).isEqualTo(new Document("a", 1).append("b", 2).hashCode());
    }

    @Test
    void testToString() throws Exception {
        Document document = new Document("_id", new ObjectId("583050b26813716e505a5bf2"))
            .append("foo", "b\"ar")
            .append("ts", new BsonTimestamp(1479561394, 1))
            .append("list", Arrays.asList(1, null, true))
            .append("nested", new Document("x", 1.5));

        assertThat(document).hasToString("{\"_id\" : ObjectId(\"583050b26813716e505a5bf2\"), \"foo\" : \"b\\\"ar\","
            + " \"ts\" : Timestamp(1479561394, 1), \"list\" : [1, null, true], \"nested\" : {\"x\" : 1.5}}");
    }

}
