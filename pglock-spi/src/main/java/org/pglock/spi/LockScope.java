package org.pglock.spi;

public enum LockScope {
    /**
     * Held by the database session until it is explicitly released or the connection closes.
     */
    SESSION,
    /**
     * Held until the current transaction commits or rolls back. Cannot be released explicitly.
     */
    TRANSACTION
}
