package org.pglock;

import com.google.common.eventbus.EventBus;
import io.airlift.log.Logger;
import org.pglock.config.LockConfig;
import org.pglock.spi.EncodedKey;
import org.pglock.spi.LockEvents.LockAcquiredEvent;
import org.pglock.spi.LockEvents.LockNotAvailableEvent;
import org.pglock.spi.LockEvents.LockReleasedEvent;
import org.pglock.spi.LockEvents.LockRolledBackEvent;
import org.pglock.spi.LockInterface;
import org.pglock.spi.LockInterfaceType;
import org.pglock.spi.LockKeyEncoder;
import org.pglock.spi.LockRequest;
import org.pglock.spi.LockScope;
import org.pglock.util.LockNotAcquiredException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Supplier;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A PostgreSQL advisory lock on a caller owned connection.
 * <p>
 * The defaults, session scope and blocking exclusive acquisition, are enough for a distributed
 * lock. The client library behind the connection is detected unless {@code lock.interface}
 * names one. An instance tracks a single lock attempt and is not safe for concurrent use.
 * <pre>{@code
 * Lock lock = new Lock(connection, "nightly-report");
 * lock.withLock(() -> generateReport());
 * }</pre>
 * Calling {@link #acquire()} on a held lock returns true without another round trip and
 * {@link #release()} on a lock that is not held returns false, so both are safe in cleanup paths.
 */
public class Lock {
    private static final Logger log = Logger.get(Lock.class);

    private final Object key;
    private final LockRequest request;
    private final LockInterface lockInterface;
    private final boolean blocking;
    private final boolean rollbackOnError;
    private final EventBus eventBus;

    private LockState state = LockState.UNACQUIRED;

    public Lock(Object connection, Object key) {
        this(connection, key, new LockConfig());
    }

    public Lock(Object connection, Object key, LockConfig config) {
        this(LockInterfaceResolver.resolve(connection, checkNotNull(config, "config is null").getInterface()), key, config, null);
    }

    /**
     * @param eventBus receives the {@link org.pglock.spi.LockEvents}, may be null
     */
    public Lock(LockInterface lockInterface, Object key, LockConfig config, EventBus eventBus) {
        this.lockInterface = checkNotNull(lockInterface, "lockInterface is null");
        this.key = checkNotNull(key, "key is null");
        checkNotNull(config, "config is null");
        EncodedKey encodedKey = LockKeyEncoder.encode(key, config.getKeyArity());
        this.request = new LockRequest(key, encodedKey, config.getScope(), !config.getExclusive());
        this.blocking = config.getBlocking();
        this.rollbackOnError = config.getRollbackOnError();
        this.eventBus = eventBus;
    }

    public Object getKey() {
        return key;
    }

    public EncodedKey getLockId() {
        return request.getEncodedKey();
    }

    public LockScope getScope() {
        return request.getScope();
    }

    public boolean isShared() {
        return request.isShared();
    }

    public boolean isBlocking() {
        return blocking;
    }

    public boolean isRollbackOnError() {
        return rollbackOnError;
    }

    public LockInterfaceType getInterfaceType() {
        return lockInterface.getType();
    }

    public LockState getState() {
        return state;
    }

    public boolean isLocked() {
        return state == LockState.ACQUIRED;
    }

    public boolean acquire() {
        return acquire(blocking);
    }

    /**
     * @param block wait until the lock is granted instead of giving up when it is taken
     * @return true if the lock is held
     */
    public boolean acquire(boolean block) {
        if (state == LockState.ACQUIRED) {
            log.debug("Lock already held for key: %s", key);
            return true;
        }

        log.info("Acquire lock for key: %s", key);
        if (block) {
            lockInterface.blockAcquire(request);
            return acquired(true);
        }
        return acquired(lockInterface.tryAcquire(request));
    }

    public CompletableFuture<Boolean> acquireAsync() {
        return acquireAsync(blocking);
    }

    public CompletableFuture<Boolean> acquireAsync(boolean block) {
        if (state == LockState.ACQUIRED) {
            log.debug("Lock already held for key: %s", key);
            return CompletableFuture.completedFuture(true);
        }

        log.info("Acquire lock for key: %s", key);
        CompletableFuture<Boolean> result = block
                ? call(() -> lockInterface.blockAcquireAsync(request)).thenApply(ignored -> true)
                : call(() -> lockInterface.tryAcquireAsync(request));
        return result.thenApply(this::acquired);
    }

    /**
     * @return what the server reported for the unlock call, false without a round trip when the
     * lock is not held or is transaction scoped
     */
    public boolean release() {
        if (state != LockState.ACQUIRED) {
            log.debug("Lock not held for key: %s", key);
            return false;
        }

        log.info("Release lock for key: %s", key);
        if (request.isTransactionScoped()) {
            // ends with the transaction
            return released(false);
        }
        return released(lockInterface.release(request));
    }

    public CompletableFuture<Boolean> releaseAsync() {
        if (state != LockState.ACQUIRED) {
            log.debug("Lock not held for key: %s", key);
            return CompletableFuture.completedFuture(false);
        }

        log.info("Release lock for key: %s", key);
        if (request.isTransactionScoped()) {
            return CompletableFuture.completedFuture(released(false));
        }
        return call(() -> lockInterface.releaseAsync(request)).thenApply(this::released);
    }

    /**
     * Rolls back the connection's transaction if rollback on error is enabled. The error itself
     * is left for the caller to rethrow.
     */
    public void handleError(Throwable error) {
        if (!rollbackOnError) {
            return;
        }
        log.info("Rollback for key: %s, %s", key, error);
        lockInterface.rollback();
        rolledBack(error);
    }

    public CompletableFuture<Void> handleErrorAsync(Throwable error) {
        if (!rollbackOnError) {
            return CompletableFuture.completedFuture(null);
        }
        log.info("Rollback for key: %s, %s", key, error);
        return call(lockInterface::rollbackAsync).thenRun(() -> rolledBack(error));
    }

    /**
     * Runs the task while holding the lock, waiting for it regardless of the default mode. If the
     * task fails the transaction is rolled back (when enabled) before the lock is released, and
     * the task's exception is rethrown as is.
     *
     * @throws LockNotAcquiredException if acquiring the lock failed
     */
    public <T, E extends Exception> T withLock(LockedTask<T, E> task)
            throws E {
        checkNotNull(task, "task is null");
        log.debug("Enter locked block for key: %s", key);
        enter();

        T result;
        try {
            result = task.run();
        } catch (Throwable e) {
            exitWithError(e);
            throw e;
        }

        log.debug("Exit locked block for key: %s", key);
        release();
        return result;
    }

    /**
     * Asynchronous counterpart of {@link #withLock(LockedTask)}. The returned future fails with
     * the task's own exception if the task fails.
     */
    public <T> CompletableFuture<T> withLockAsync(Supplier<? extends CompletionStage<T>> task) {
        checkNotNull(task, "task is null");
        log.debug("Enter locked block for key: %s", key);

        CompletableFuture<Boolean> entered = acquireAsync(true).handle((acquired, error) -> {
            if (error != null || !acquired) {
                throw new LockNotAcquiredException(key, error == null ? null : unwrap(error));
            }
            return true;
        });

        return entered.thenCompose(ignored -> CompletableFuture.<Void>completedFuture(null)
                .thenCompose(start -> task.get())
                .handle((result, error) -> {
                    log.debug("Exit locked block for key: %s", key);
                    if (error == null) {
                        return releaseAsync().thenApply(released -> result);
                    }
                    return this.<T>exitWithErrorAsync(unwrap(error));
                })
                .thenCompose(Function.identity()));
    }

    private void enter() {
        boolean acquired;
        try {
            acquired = acquire(true);
        } catch (RuntimeException e) {
            throw new LockNotAcquiredException(key, e);
        }
        if (!acquired) {
            throw new LockNotAcquiredException(key, null);
        }
    }

    private void exitWithError(Throwable error) {
        try {
            handleError(error);
        } catch (RuntimeException e) {
            log.warn(e, "Rollback failed for key: %s", key);
            error.addSuppressed(e);
        }
        try {
            release();
        } catch (RuntimeException e) {
            log.warn(e, "Release failed for key: %s", key);
            error.addSuppressed(e);
        }
    }

    private <T> CompletableFuture<T> exitWithErrorAsync(Throwable error) {
        CompletableFuture<T> exit = new CompletableFuture<>();
        handleErrorAsync(error)
                .handle((ignored, rollbackError) -> {
                    if (rollbackError != null) {
                        log.warn(unwrap(rollbackError), "Rollback failed for key: %s", key);
                        error.addSuppressed(unwrap(rollbackError));
                    }
                    return null;
                })
                .thenCompose(ignored -> releaseAsync())
                .whenComplete((released, releaseError) -> {
                    if (releaseError != null) {
                        log.warn(unwrap(releaseError), "Release failed for key: %s", key);
                        error.addSuppressed(unwrap(releaseError));
                    }
                    exit.completeExceptionally(error);
                });
        return exit;
    }

    private boolean acquired(boolean acquired) {
        if (acquired) {
            state = LockState.ACQUIRED;
            post(new LockAcquiredEvent(key, request.getEncodedKey(), request.getScope(), request.isShared()));
        } else {
            log.debug("Lock not available for key: %s", key);
            post(new LockNotAvailableEvent(key, request.getEncodedKey()));
        }
        return acquired;
    }

    private boolean released(boolean released) {
        state = LockState.RELEASED;
        post(new LockReleasedEvent(key, request.getEncodedKey(), released));
        return released;
    }

    private void rolledBack(Throwable error) {
        if (request.isTransactionScoped() && state == LockState.ACQUIRED) {
            // the rollback ended the transaction that held the lock
            state = LockState.RELEASED;
        }
        post(new LockRolledBackEvent(key, error));
    }

    private void post(Object event) {
        if (eventBus != null) {
            eventBus.post(event);
        }
    }

    private static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> operation) {
        try {
            return operation.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    @Override
    public String toString() {
        return toStringHelper(this)
                .add("key", key)
                .add("lockId", request.getEncodedKey())
                .add("scope", request.getScope())
                .add("shared", request.isShared())
                .add("interface", lockInterface.getType())
                .add("state", state)
                .toString();
    }
}
