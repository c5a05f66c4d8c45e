package org.pglock.jdbc;

import io.airlift.log.Logger;
import org.pglock.spi.AbstractSynchronousLockInterface;
import org.pglock.spi.LockInterfaceType;
import org.pglock.spi.LockRequest;
import org.pglock.util.LockConnectionException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.String.format;

public class JdbcLockInterface
        extends AbstractSynchronousLockInterface {
    private static final Logger log = Logger.get(JdbcLockInterface.class);

    private final Connection connection;

    public JdbcLockInterface(Connection connection) {
        this.connection = checkNotNull(connection, "connection is null");
    }

    @Override
    public LockInterfaceType getType() {
        return LockInterfaceType.JDBC;
    }

    @Override
    public boolean tryAcquire(LockRequest request) {
        String query = request.lockStatement(false, i -> "?");
        log.debug("Acquire statement for key: %s, %s", request.getKey(), query);
        // only a literal false means the lock is taken
        return !Boolean.FALSE.equals(queryBoolean(query, request));
    }

    @Override
    public void blockAcquire(LockRequest request) {
        String query = request.lockStatement(true, i -> "?");
        log.debug("Acquire statement for key: %s, %s", request.getKey(), query);
        queryBoolean(query, request);
    }

    @Override
    public boolean release(LockRequest request) {
        if (request.isTransactionScoped()) {
            return false;
        }
        String query = request.unlockStatement(i -> "?");
        log.debug("Release statement for key: %s, %s", request.getKey(), query);
        return Boolean.TRUE.equals(queryBoolean(query, request));
    }

    @Override
    public void rollback() {
        try {
            // JDBC refuses to roll back in auto-commit mode, there is no transaction then
            if (!connection.getAutoCommit()) {
                connection.rollback();
            }
        } catch (SQLException e) {
            throw new LockConnectionException("Rollback failed", e);
        }
    }

    private Boolean queryBoolean(String query, LockRequest request) {
        try (PreparedStatement statement = connection.prepareStatement(query)) {
            List<Object> parameters = request.getEncodedKey().getParameters();
            for (int i = 0; i < parameters.size(); i++) {
                Object parameter = parameters.get(i);
                if (parameter instanceof Long) {
                    statement.setLong(i + 1, (Long) parameter);
                } else {
                    statement.setInt(i + 1, (Integer) parameter);
                }
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return null;
                }
                Object value = resultSet.getObject(1);
                return value instanceof Boolean ? (Boolean) value : null;
            }
        } catch (SQLException e) {
            throw new LockConnectionException(format("Error while executing '%s' for key %s", query, request.getKey()), e);
        }
    }
}
