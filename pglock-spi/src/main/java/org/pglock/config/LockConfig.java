package org.pglock.config;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import org.pglock.spi.LockInterfaceType;
import org.pglock.spi.LockScope;

import static com.google.common.base.Preconditions.checkArgument;

public class LockConfig {
    private LockScope scope = LockScope.SESSION;
    private String lockInterface = LockInterfaceType.AUTO;
    private boolean rollbackOnError = true;
    private boolean exclusive = true;
    private boolean blocking = true;
    private int keyArity = 1;

    public LockScope getScope() {
        return scope;
    }

    @Config("lock.scope")
    @ConfigDescription("SESSION keeps the lock until it is released, TRANSACTION until the transaction ends")
    public LockConfig setScope(LockScope scope) {
        this.scope = scope;
        return this;
    }

    public String getInterface() {
        return lockInterface;
    }

    @Config("lock.interface")
    @ConfigDescription("Client library family of the connection (jdbc, jdbi, r2dbc, vertx), or auto to detect it")
    public LockConfig setInterface(String lockInterface) {
        this.lockInterface = lockInterface == null || lockInterface.isEmpty() ? LockInterfaceType.AUTO : lockInterface;
        return this;
    }

    public boolean getRollbackOnError() {
        return rollbackOnError;
    }

    @Config("lock.rollback-on-error")
    @ConfigDescription("Roll back the connection's transaction when a locked block fails")
    public LockConfig setRollbackOnError(boolean rollbackOnError) {
        this.rollbackOnError = rollbackOnError;
        return this;
    }

    public boolean getExclusive() {
        return exclusive;
    }

    @Config("lock.exclusive")
    @ConfigDescription("false takes a shared lock that only conflicts with exclusive holders")
    public LockConfig setExclusive(boolean exclusive) {
        this.exclusive = exclusive;
        return this;
    }

    public boolean getBlocking() {
        return blocking;
    }

    @Config("lock.blocking")
    @ConfigDescription("Default mode of acquire() calls that do not specify one")
    public LockConfig setBlocking(boolean blocking) {
        this.blocking = blocking;
        return this;
    }

    public int getKeyArity() {
        return keyArity;
    }

    @Config("lock.key-arity")
    @ConfigDescription("1 to lock on a bigint key, 2 to lock on a pair of int keys")
    public LockConfig setKeyArity(int keyArity) {
        checkArgument(keyArity == 1 || keyArity == 2, "lock.key-arity must be 1 or 2");
        this.keyArity = keyArity;
        return this;
    }

    public LockConfig copy() {
        return new LockConfig()
                .setScope(scope)
                .setInterface(lockInterface)
                .setRollbackOnError(rollbackOnError)
                .setExclusive(exclusive)
                .setBlocking(blocking)
                .setKeyArity(keyArity);
    }
}
