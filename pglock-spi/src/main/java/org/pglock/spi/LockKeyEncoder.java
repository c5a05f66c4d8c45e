package org.pglock.spi;

import com.google.common.hash.Hashing;
import com.google.common.primitives.Longs;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Maps lock keys to advisory lock ids. Integral keys are used as they are, anything else is
 * hashed from its text so that every process contending for the same key agrees on the id.
 */
public final class LockKeyEncoder {
    private LockKeyEncoder()
            throws InstantiationException {
        throw new InstantiationException("The class is not created for instantiation");
    }

    public static EncodedKey encode(Object key, int arity) {
        return EncodedKey.of(lockId(key), arity);
    }

    public static long lockId(Object key) {
        checkNotNull(key, "key is null");

        if (key instanceof Long || key instanceof Integer || key instanceof Short || key instanceof Byte
                || key instanceof AtomicLong || key instanceof AtomicInteger) {
            return ((Number) key).longValue();
        }
        if (key instanceof BigInteger) {
            // keeps the low-order 64 bits, out of range values wrap around
            return ((BigInteger) key).longValue();
        }
        return hash(canonicalBytes(key));
    }

    @SuppressWarnings("deprecation")
    private static long hash(byte[] bytes) {
        return Longs.fromByteArray(Hashing.sha1().hashBytes(bytes).asBytes());
    }

    private static byte[] canonicalBytes(Object key) {
        if (key instanceof byte[]) {
            return (byte[]) key;
        }
        if (key instanceof CharSequence) {
            return key.toString().getBytes(UTF_8);
        }
        if (key.getClass().isArray()) {
            // renders element values, "[1, 2]" for an int[] {1, 2}
            String text = Arrays.deepToString(new Object[] {key});
            return text.substring(1, text.length() - 1).getBytes(UTF_8);
        }
        return String.valueOf(key).getBytes(UTF_8);
    }
}
