package org.pglock;

import io.airlift.log.Logger;
import io.r2dbc.spi.Connection;
import io.vertx.sqlclient.SqlConnection;
import org.pglock.jdbc.JdbcLockInterface;
import org.pglock.jdbi.JdbiLockInterface;
import org.pglock.r2dbc.R2dbcLockInterface;
import org.pglock.spi.LockInterface;
import org.pglock.spi.LockInterfaceType;
import org.pglock.util.UnsupportedInterfaceException;
import org.pglock.vertx.VertxLockInterface;
import org.skife.jdbi.v2.Handle;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.String.format;

/**
 * Picks the {@link LockInterface} that drives a connection. Detection only looks at the
 * connection's type and never talks to the database.
 */
public final class LockInterfaceResolver {
    private static final Logger log = Logger.get(LockInterfaceResolver.class);

    private LockInterfaceResolver()
            throws InstantiationException {
        throw new InstantiationException("The class is not created for instantiation");
    }

    public static LockInterface resolve(Object connection) {
        return resolve(connection, LockInterfaceType.AUTO);
    }

    /**
     * @param interfaceName one of the {@link LockInterfaceType} names, or {@code auto}
     * @throws UnsupportedInterfaceException if the name is unknown, the connection type is not
     * recognized, or the connection does not belong to the named family
     */
    public static LockInterface resolve(Object connection, String interfaceName) {
        checkNotNull(connection, "connection is null");

        LockInterfaceType type;
        if (interfaceName == null || LockInterfaceType.AUTO.equalsIgnoreCase(interfaceName.trim())) {
            type = detect(connection);
        } else {
            type = LockInterfaceType.fromName(interfaceName);
            if (!type.matches(connection)) {
                throw new UnsupportedInterfaceException(format("Connection of type %s is not a %s connection",
                        connection.getClass().getName(), type.getName()));
            }
        }

        log.debug("Using %s interface for connection %s", type.getName(), connection.getClass().getName());
        return create(type, connection);
    }

    public static LockInterfaceType detect(Object connection) {
        checkNotNull(connection, "connection is null");
        for (LockInterfaceType type : LockInterfaceType.values()) {
            if (type.matches(connection)) {
                return type;
            }
        }
        throw new UnsupportedInterfaceException(format("Cannot determine database interface of %s, " +
                "try specifying it with the lock.interface option", connection.getClass().getName()));
    }

    private static LockInterface create(LockInterfaceType type, Object connection) {
        switch (type) {
            case JDBC:
                return new JdbcLockInterface((java.sql.Connection) connection);
            case JDBI:
                return new JdbiLockInterface((Handle) connection);
            case R2DBC:
                return new R2dbcLockInterface((Connection) connection);
            case VERTX:
                return new VertxLockInterface((SqlConnection) connection);
            default:
                throw new IllegalStateException("Unknown interface type " + type);
        }
    }
}
