package org.pglock.spi;

import static java.lang.String.format;

/**
 * Base for client libraries that only offer non-blocking calls.
 */
public abstract class AbstractAsynchronousLockInterface
        implements LockInterface {
    @Override
    public boolean tryAcquire(LockRequest request) {
        throw unsupported("tryAcquire");
    }

    @Override
    public void blockAcquire(LockRequest request) {
        throw unsupported("blockAcquire");
    }

    @Override
    public boolean release(LockRequest request) {
        throw unsupported("release");
    }

    @Override
    public void rollback() {
        throw unsupported("rollback");
    }

    private UnsupportedOperationException unsupported(String operation) {
        return new UnsupportedOperationException(
                format("%s interface does not support %s()", getType().getName(), operation));
    }
}
