package de.bwaldvogel.oplog.bson;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import nl.jqno.equalsverifier.EqualsVerifier;

class BsonTimestampTest {

    @Test
    void testEqualsHashCodeContract() throws Exception {
        EqualsVerifier.forClass(BsonTimestamp.class).verify();
    }

    @Test
    void testToString() throws Exception {
        assertThat(new BsonTimestamp(123, 456))
            .hasToString("BsonTimestamp[value=528280977864, seconds=123, inc=456]");
    }

    @Test
    void testTimeAndIncrement() throws Exception {
        BsonTimestamp timestamp = new BsonTimestamp(1479419535, 7);
        assertThat(timestamp.getValue()).isEqualTo((1479419535L << 32) | 7);
        assertThat(timestamp.getTime()).isEqualTo(1479419535);
        assertThat(timestamp.getInc()).isEqualTo(7);
    }

    @Test
    void testNegativeIncrementIsKeptInLowHalf() throws Exception {
        BsonTimestamp timestamp = new BsonTimestamp(1, -1);
        assertThat(timestamp.getValue()).isEqualTo(0x1FFFFFFFFL);
        assertThat(timestamp.getTime()).isEqualTo(1);
        assertThat(timestamp.getInc()).isEqualTo(-1);
    }

    @Test
    void testCompareIsUnsigned() throws Exception {
        BsonTimestamp small = new BsonTimestamp(1L);
        BsonTimestamp large = new BsonTimestamp(-1L);
        assertThat(small).isLessThan(large);
        assertThat(large).isGreaterThan(small);
        assertThat(small.compareTo(new BsonTimestamp(1L))).isZero();
    }

}
