package org.pglock.spi;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.stream.Collectors.joining;
import static java.util.stream.IntStream.range;

/**
 * Integer arguments of an advisory lock function: either a single {@code bigint} or a pair of
 * {@code int} values. Both forms carry the same 64-bit lock id, the pair being its high and
 * low halves. The server keeps the two forms in separate key spaces.
 */
public final class EncodedKey {
    private final long lockId;
    private final int arity;

    private EncodedKey(long lockId, int arity) {
        this.lockId = lockId;
        this.arity = arity;
    }

    public static EncodedKey of(long lockId, int arity) {
        if (arity != 1 && arity != 2) {
            throw new IllegalArgumentException("arity must be 1 or 2: " + arity);
        }
        return new EncodedKey(lockId, arity);
    }

    public static EncodedKey bigint(long lockId) {
        return new EncodedKey(lockId, 1);
    }

    public static EncodedKey intPair(int high, int low) {
        return new EncodedKey(((long) high << 32) | (low & 0xFFFFFFFFL), 2);
    }

    public long getLockId() {
        return lockId;
    }

    public int getArity() {
        return arity;
    }

    public int getHigh() {
        return (int) (lockId >>> 32);
    }

    public int getLow() {
        return (int) lockId;
    }

    /**
     * Function arguments in call order, {@link Long} for the single form and {@link Integer}
     * for the pair.
     */
    public List<Object> getParameters() {
        if (arity == 1) {
            return ImmutableList.of(lockId);
        }
        return ImmutableList.of(getHigh(), getLow());
    }

    /**
     * Renders the argument list of a function call, e.g. {@code "?"} or {@code "$1, $2"}.
     *
     * @param placeholder maps the zero-based parameter index to the driver's placeholder
     */
    public String placeholders(IntFunction<String> placeholder) {
        return range(0, arity).mapToObj(placeholder).collect(joining(", "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EncodedKey that = (EncodedKey) o;
        return lockId == that.lockId && arity == that.arity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lockId, arity);
    }

    @Override
    public String toString() {
        return toStringHelper(this)
                .add("parameters", getParameters())
                .toString();
    }
}
