package org.pglock;

import com.google.common.eventbus.EventBus;
import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import org.pglock.config.LockConfig;

import static io.airlift.configuration.ConfigBinder.configBinder;

public class PgLockModule
        implements Module {
    private final boolean bindEventBus;

    public PgLockModule() {
        this(true);
    }

    /**
     * @param bindEventBus false when the application binds its own {@link EventBus}
     */
    public PgLockModule(boolean bindEventBus) {
        this.bindEventBus = bindEventBus;
    }

    @Override
    public void configure(Binder binder) {
        configBinder(binder).bindConfig(LockConfig.class);
        if (bindEventBus) {
            binder.bind(EventBus.class).toInstance(new EventBus("pglock"));
        }
        binder.bind(LockFactory.class).in(Scopes.SINGLETON);
    }
}
