package org.pglock.util;

public class UnsupportedInterfaceException
        extends LockException {
    public UnsupportedInterfaceException(String message) {
        super(message);
    }
}
