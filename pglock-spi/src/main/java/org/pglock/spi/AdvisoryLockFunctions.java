package org.pglock.spi;

import static com.google.common.base.Preconditions.checkNotNull;

public final class AdvisoryLockFunctions {
    private AdvisoryLockFunctions()
            throws InstantiationException {
        throw new InstantiationException("The class is not created for instantiation");
    }

    public static String blockingLockFunction(LockScope scope, boolean shared) {
        return "pg_advisory" + infix(scope) + "_lock" + suffix(shared);
    }

    public static String tryLockFunction(LockScope scope, boolean shared) {
        return "pg_try_advisory" + infix(scope) + "_lock" + suffix(shared);
    }

    /**
     * Transaction level locks have no unlock function, they are released when the
     * transaction ends.
     */
    public static String unlockFunction(boolean shared) {
        return "pg_advisory_unlock" + suffix(shared);
    }

    public static String statement(String function, String arguments) {
        return "SELECT pg_catalog." + function + "(" + arguments + ")";
    }

    private static String infix(LockScope scope) {
        checkNotNull(scope, "scope is null");
        return scope == LockScope.TRANSACTION ? "_xact" : "";
    }

    private static String suffix(boolean shared) {
        return shared ? "_shared" : "";
    }
}
