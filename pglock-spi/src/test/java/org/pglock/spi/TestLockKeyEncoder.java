package org.pglock.spi;

import org.testng.annotations.Test;

import java.math.BigInteger;
import java.util.UUID;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.expectThrows;

public class TestLockKeyEncoder {
    @Test
    public void testStringKeyUsesSha1Prefix() {
        assertEquals(LockKeyEncoder.lockId("k1"), -6725253745254088798L);
        assertEquals(LockKeyEncoder.lockId("key"), -6471916593987141716L);
    }

    @Test
    public void testStringKeyIsDeterministic() {
        String key = "resource:" + 42;
        assertEquals(LockKeyEncoder.encode(key, 1), LockKeyEncoder.encode("resource:42", 1));
        assertEquals(LockKeyEncoder.lockId(new StringBuilder("resource:42")), -4885626141874526654L);
    }

    @Test
    public void testBytesHashLikeTheirText() {
        assertEquals(LockKeyEncoder.lockId("k1".getBytes(UTF_8)), LockKeyEncoder.lockId("k1"));
    }

    @Test
    public void testIntegralKeysPassThrough() {
        assertEquals(LockKeyEncoder.lockId(42L), 42L);
        assertEquals(LockKeyEncoder.lockId(-7), -7L);
        assertEquals(LockKeyEncoder.lockId((short) 3), 3L);
        assertEquals(LockKeyEncoder.lockId(Long.MIN_VALUE), Long.MIN_VALUE);
        assertEquals(LockKeyEncoder.lockId(BigInteger.valueOf(123456789L)), 123456789L);
    }

    @Test
    public void testLargeIntegersWrap() {
        assertEquals(LockKeyEncoder.lockId(BigInteger.ONE.shiftLeft(64).add(BigInteger.valueOf(5))), 5L);
        assertEquals(LockKeyEncoder.lockId(BigInteger.ONE.shiftLeft(63)), Long.MIN_VALUE);
    }

    @Test
    public void testNonIntegralNumbersAreHashed() {
        assertEquals(LockKeyEncoder.lockId(3.5), -4330655148178946356L);
    }

    @Test
    public void testObjectKeysHashTheirValue() {
        UUID uuid = UUID.fromString("2f1b7c52-62f5-4c8e-9a52-2cf4a1d1e0a7");
        assertEquals(LockKeyEncoder.lockId(uuid), LockKeyEncoder.lockId(UUID.fromString(uuid.toString())));
        assertEquals(LockKeyEncoder.lockId(uuid), LockKeyEncoder.lockId(uuid.toString()));
        assertNotEquals(LockKeyEncoder.lockId(uuid), LockKeyEncoder.lockId(UUID.randomUUID()));
    }

    @Test
    public void testArrayKeysHashTheirValue() {
        assertEquals(LockKeyEncoder.lockId(new int[] {1, 2}), LockKeyEncoder.lockId(new int[] {1, 2}));
        assertEquals(LockKeyEncoder.lockId(new int[] {1, 2}), LockKeyEncoder.lockId("[1, 2]"));
        assertNotEquals(LockKeyEncoder.lockId(new int[] {1, 2}), LockKeyEncoder.lockId(new int[] {2, 1}));
        assertEquals(LockKeyEncoder.lockId(new Object[] {"a", new long[] {3L}}), LockKeyEncoder.lockId(new Object[] {"a", new long[] {3L}}));
    }

    @Test
    public void testIntPairSplitsLockId() {
        EncodedKey key = LockKeyEncoder.encode("k1", 2);
        assertEquals(key.getArity(), 2);
        assertEquals(key.getHigh(), -1565845159);
        assertEquals(key.getLow(), -1044136030);
        assertEquals(EncodedKey.intPair(-1565845159, -1044136030), key);
    }

    @Test
    public void testIntPairOfSmallInteger() {
        EncodedKey key = LockKeyEncoder.encode(7L, 2);
        assertEquals(key.getParameters().get(0), 0);
        assertEquals(key.getParameters().get(1), 7);
    }

    @Test
    public void testNullKeyIsRejected() {
        expectThrows(NullPointerException.class, () -> LockKeyEncoder.lockId(null));
    }

    @Test
    public void testInvalidArity() {
        expectThrows(IllegalArgumentException.class, () -> LockKeyEncoder.encode("k1", 3));
    }
}
