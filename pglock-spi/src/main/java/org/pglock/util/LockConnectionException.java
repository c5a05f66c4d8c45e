package org.pglock.util;

/**
 * A database round trip issued for a lock operation failed. The client library's
 * exception is kept as the cause.
 */
public class LockConnectionException
        extends LockException {
    public LockConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
