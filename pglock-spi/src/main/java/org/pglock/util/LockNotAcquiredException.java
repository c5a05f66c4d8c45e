package org.pglock.util;

import static java.lang.String.format;

public class LockNotAcquiredException
        extends LockException {
    public LockNotAcquiredException(Object key, Throwable cause) {
        super(format("Lock for '%s' could not be acquired", key), cause);
    }
}
