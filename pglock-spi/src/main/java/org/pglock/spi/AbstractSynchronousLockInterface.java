package org.pglock.spi;

import java.util.concurrent.CompletableFuture;

import static java.lang.String.format;

/**
 * Base for client libraries that only offer blocking calls.
 */
public abstract class AbstractSynchronousLockInterface
        implements LockInterface {
    @Override
    public CompletableFuture<Boolean> tryAcquireAsync(LockRequest request) {
        return unsupported("tryAcquireAsync");
    }

    @Override
    public CompletableFuture<Void> blockAcquireAsync(LockRequest request) {
        return unsupported("blockAcquireAsync");
    }

    @Override
    public CompletableFuture<Boolean> releaseAsync(LockRequest request) {
        return unsupported("releaseAsync");
    }

    @Override
    public CompletableFuture<Void> rollbackAsync() {
        return unsupported("rollbackAsync");
    }

    private <T> CompletableFuture<T> unsupported(String operation) {
        return CompletableFuture.failedFuture(new UnsupportedOperationException(
                format("%s interface does not support %s()", getType().getName(), operation)));
    }
}
