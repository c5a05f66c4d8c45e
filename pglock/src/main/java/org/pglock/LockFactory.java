package org.pglock;

import com.google.common.eventbus.EventBus;
import org.pglock.config.LockConfig;

import javax.inject.Inject;
import java.util.function.UnaryOperator;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Creates {@link Lock}s with the configured defaults, posting their events to the shared
 * {@link EventBus}.
 */
public class LockFactory {
    private final LockConfig config;
    private final EventBus eventBus;

    @Inject
    public LockFactory(LockConfig config, EventBus eventBus) {
        this.config = checkNotNull(config, "config is null");
        this.eventBus = checkNotNull(eventBus, "eventBus is null");
    }

    public LockConfig getConfig() {
        return config;
    }

    public Lock create(Object connection, Object key) {
        return create(connection, key, config);
    }

    /**
     * @param overrides adjusts a copy of the defaults for this lock only
     */
    public Lock create(Object connection, Object key, UnaryOperator<LockConfig> overrides) {
        return create(connection, key, overrides.apply(config.copy()));
    }

    private Lock create(Object connection, Object key, LockConfig lockConfig) {
        return new Lock(LockInterfaceResolver.resolve(connection, lockConfig.getInterface()), key, lockConfig, eventBus);
    }
}
