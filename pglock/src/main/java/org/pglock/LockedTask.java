package org.pglock;

/**
 * Work executed while a lock is held.
 */
@FunctionalInterface
public interface LockedTask<T, E extends Exception> {
    T run()
            throws E;
}
