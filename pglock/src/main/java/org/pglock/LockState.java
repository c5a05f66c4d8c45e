package org.pglock;

public enum LockState {
    UNACQUIRED,
    ACQUIRED,
    RELEASED
}
