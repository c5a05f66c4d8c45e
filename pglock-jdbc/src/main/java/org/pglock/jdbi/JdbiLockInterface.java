package org.pglock.jdbi;

import io.airlift.log.Logger;
import org.pglock.spi.AbstractSynchronousLockInterface;
import org.pglock.spi.LockInterfaceType;
import org.pglock.spi.LockRequest;
import org.pglock.util.LockConnectionException;
import org.skife.jdbi.v2.Handle;
import org.skife.jdbi.v2.Query;
import org.skife.jdbi.v2.exceptions.DBIException;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.String.format;

/**
 * Lock calls through a JDBI {@link Handle}. Parameters are bound by name as {@code :key0}
 * and {@code :key1}.
 */
public class JdbiLockInterface
        extends AbstractSynchronousLockInterface {
    private static final Logger log = Logger.get(JdbiLockInterface.class);

    private final Handle handle;

    public JdbiLockInterface(Handle handle) {
        this.handle = checkNotNull(handle, "handle is null");
    }

    @Override
    public LockInterfaceType getType() {
        return LockInterfaceType.JDBI;
    }

    @Override
    public boolean tryAcquire(LockRequest request) {
        String query = request.lockStatement(false, JdbiLockInterface::parameterName);
        log.debug("Acquire statement for key: %s, %s", request.getKey(), query);
        return !Boolean.FALSE.equals(first(query, request));
    }

    @Override
    public void blockAcquire(LockRequest request) {
        String query = request.lockStatement(true, JdbiLockInterface::parameterName);
        log.debug("Acquire statement for key: %s, %s", request.getKey(), query);
        first(query, request);
    }

    @Override
    public boolean release(LockRequest request) {
        if (request.isTransactionScoped()) {
            return false;
        }
        String query = request.unlockStatement(JdbiLockInterface::parameterName);
        log.debug("Release statement for key: %s, %s", request.getKey(), query);
        return Boolean.TRUE.equals(first(query, request));
    }

    @Override
    public void rollback() {
        try {
            if (handle.isInTransaction()) {
                handle.rollback();
            }
        } catch (DBIException e) {
            throw new LockConnectionException("Rollback failed", e);
        }
    }

    private Object first(String query, LockRequest request) {
        try {
            Query<Map<String, Object>> statement = handle.createQuery(query);
            List<Object> parameters = request.getEncodedKey().getParameters();
            for (int i = 0; i < parameters.size(); i++) {
                Object parameter = parameters.get(i);
                if (parameter instanceof Long) {
                    statement.bind("key" + i, (long) (Long) parameter);
                } else {
                    statement.bind("key" + i, (int) (Integer) parameter);
                }
            }
            Map<String, Object> row = statement.first();
            if (row == null || row.isEmpty()) {
                return null;
            }
            return row.values().iterator().next();
        } catch (DBIException e) {
            throw new LockConnectionException(format("Error while executing '%s' for key %s", query, request.getKey()), e);
        }
    }

    private static String parameterName(int index) {
        return ":key" + index;
    }
}
