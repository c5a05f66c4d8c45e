package org.pglock.spi;

import java.util.concurrent.CompletableFuture;

/**
 * Issues advisory lock calls through one client library. An instance is bound to a single
 * connection that the caller owns; every operation is exactly one round trip.
 * <p>
 * Client library failures surface as {@link org.pglock.util.LockConnectionException}, on the
 * returned future for the asynchronous operations. A family that lacks one of the execution
 * styles fails those operations with {@link UnsupportedOperationException}.
 */
public interface LockInterface {
    LockInterfaceType getType();

    /**
     * Attempts the lock once without waiting.
     *
     * @return true if the lock was granted
     */
    boolean tryAcquire(LockRequest request);

    /**
     * Blocks the calling thread until the server grants the lock.
     */
    void blockAcquire(LockRequest request);

    /**
     * @return true if a lock was held and has been released, false if none was held or the
     * lock is transaction scoped
     */
    boolean release(LockRequest request);

    /**
     * Rolls back the current transaction, harmless when none is active.
     */
    void rollback();

    CompletableFuture<Boolean> tryAcquireAsync(LockRequest request);

    CompletableFuture<Void> blockAcquireAsync(LockRequest request);

    CompletableFuture<Boolean> releaseAsync(LockRequest request);

    CompletableFuture<Void> rollbackAsync();
}
