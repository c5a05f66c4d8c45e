package org.pglock.spi;

import org.pglock.util.UnsupportedInterfaceException;

import static java.lang.String.format;
import static java.util.Locale.ENGLISH;

/**
 * Client library families a lock can be driven through. Each family is recognized by the
 * connection type its library hands out; the types are referenced by name so that a family
 * whose library is missing from the classpath simply never matches.
 */
public enum LockInterfaceType {
    JDBC("jdbc", "java.sql.Connection"),
    JDBI("jdbi", "org.skife.jdbi.v2.Handle"),
    R2DBC("r2dbc", "io.r2dbc.spi.Connection"),
    VERTX("vertx", "io.vertx.sqlclient.SqlConnection");

    public static final String AUTO = "auto";

    private final String name;
    private final String connectionClassName;

    LockInterfaceType(String name, String connectionClassName) {
        this.name = name;
        this.connectionClassName = connectionClassName;
    }

    public String getName() {
        return name;
    }

    public String getConnectionClassName() {
        return connectionClassName;
    }

    /**
     * Returns true when the connection is an instance of this family's connection type.
     * Only inspects types, the connection itself is not touched.
     */
    public boolean matches(Object connection) {
        Class<?> connectionClass = loadConnectionClass(connection.getClass().getClassLoader());
        if (connectionClass == null) {
            connectionClass = loadConnectionClass(LockInterfaceType.class.getClassLoader());
        }
        return connectionClass != null && connectionClass.isInstance(connection);
    }

    private Class<?> loadConnectionClass(ClassLoader classLoader) {
        try {
            return Class.forName(connectionClassName, false, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            return null;
        }
    }

    public static LockInterfaceType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(ENGLISH);
            for (LockInterfaceType type : values()) {
                if (type.name.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new UnsupportedInterfaceException(format("Unsupported database interface '%s'", name));
    }
}
