package org.pglock.spi;

public final class LockEvents {

    private LockEvents()
            throws InstantiationException {
        throw new InstantiationException("The class is not created for instantiation");
    }

    public static class LockAcquiredEvent {
        public final Object key;
        public final EncodedKey encodedKey;
        public final LockScope scope;
        public final boolean shared;

        public LockAcquiredEvent(Object key, EncodedKey encodedKey, LockScope scope, boolean shared) {
            this.key = key;
            this.encodedKey = encodedKey;
            this.scope = scope;
            this.shared = shared;
        }
    }

    public static class LockNotAvailableEvent {
        public final Object key;
        public final EncodedKey encodedKey;

        public LockNotAvailableEvent(Object key, EncodedKey encodedKey) {
            this.key = key;
            this.encodedKey = encodedKey;
        }
    }

    public static class LockReleasedEvent {
        public final Object key;
        public final EncodedKey encodedKey;
        public final boolean released;

        public LockReleasedEvent(Object key, EncodedKey encodedKey, boolean released) {
            this.key = key;
            this.encodedKey = encodedKey;
            this.released = released;
        }
    }

    public static class LockRolledBackEvent {
        public final Object key;
        public final Throwable cause;

        public LockRolledBackEvent(Object key, Throwable cause) {
            this.key = key;
            this.cause = cause;
        }
    }
}
