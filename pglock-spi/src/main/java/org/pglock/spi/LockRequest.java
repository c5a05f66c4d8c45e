package org.pglock.spi;

import java.util.function.IntFunction;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Everything an adapter needs to issue a lock call: the encoded key, the scope and whether
 * the lock is shared. The caller's key is kept for log messages only.
 */
public final class LockRequest {
    private final Object key;
    private final EncodedKey encodedKey;
    private final LockScope scope;
    private final boolean shared;

    public LockRequest(Object key, EncodedKey encodedKey, LockScope scope, boolean shared) {
        this.key = checkNotNull(key, "key is null");
        this.encodedKey = checkNotNull(encodedKey, "encodedKey is null");
        this.scope = checkNotNull(scope, "scope is null");
        this.shared = shared;
    }

    public Object getKey() {
        return key;
    }

    public EncodedKey getEncodedKey() {
        return encodedKey;
    }

    public LockScope getScope() {
        return scope;
    }

    public boolean isShared() {
        return shared;
    }

    public boolean isTransactionScoped() {
        return scope == LockScope.TRANSACTION;
    }

    public String lockFunction(boolean block) {
        return block
                ? AdvisoryLockFunctions.blockingLockFunction(scope, shared)
                : AdvisoryLockFunctions.tryLockFunction(scope, shared);
    }

    public String unlockFunction() {
        return AdvisoryLockFunctions.unlockFunction(shared);
    }

    public String lockStatement(boolean block, IntFunction<String> placeholder) {
        return AdvisoryLockFunctions.statement(lockFunction(block), encodedKey.placeholders(placeholder));
    }

    public String unlockStatement(IntFunction<String> placeholder) {
        return AdvisoryLockFunctions.statement(unlockFunction(), encodedKey.placeholders(placeholder));
    }

    @Override
    public String toString() {
        return toStringHelper(this)
                .add("key", key)
                .add("encodedKey", encodedKey)
                .add("scope", scope)
                .add("shared", shared)
                .toString();
    }
}
