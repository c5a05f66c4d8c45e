package org.pglock.vertx;

import io.airlift.log.Logger;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowIterator;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Transaction;
import io.vertx.sqlclient.Tuple;
import org.pglock.spi.AbstractAsynchronousLockInterface;
import org.pglock.spi.LockInterfaceType;
import org.pglock.spi.LockRequest;
import org.pglock.util.LockConnectionException;

import java.util.concurrent.CompletableFuture;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.String.format;

public class VertxLockInterface
        extends AbstractAsynchronousLockInterface {
    private static final Logger log = Logger.get(VertxLockInterface.class);

    private final SqlConnection connection;

    public VertxLockInterface(SqlConnection connection) {
        this.connection = checkNotNull(connection, "connection is null");
    }

    @Override
    public LockInterfaceType getType() {
        return LockInterfaceType.VERTX;
    }

    @Override
    public CompletableFuture<Boolean> tryAcquireAsync(LockRequest request) {
        String query = request.lockStatement(false, VertxLockInterface::placeholder);
        log.debug("Acquire statement for key: %s, %s", request.getKey(), query);
        return toCompletableFuture(queryValue(query, request).map(value -> !Boolean.FALSE.equals(value)));
    }

    @Override
    public CompletableFuture<Void> blockAcquireAsync(LockRequest request) {
        String query = request.lockStatement(true, VertxLockInterface::placeholder);
        log.debug("Acquire statement for key: %s, %s", request.getKey(), query);
        return toCompletableFuture(queryValue(query, request).mapEmpty());
    }

    @Override
    public CompletableFuture<Boolean> releaseAsync(LockRequest request) {
        if (request.isTransactionScoped()) {
            return CompletableFuture.completedFuture(false);
        }
        String query = request.unlockStatement(VertxLockInterface::placeholder);
        log.debug("Release statement for key: %s, %s", request.getKey(), query);
        return toCompletableFuture(queryValue(query, request).map(Boolean.TRUE::equals));
    }

    @Override
    public CompletableFuture<Void> rollbackAsync() {
        Transaction transaction = connection.transaction();
        Future<Void> rollback;
        if (transaction != null) {
            // ends the caller's transaction object as well
            rollback = transaction.rollback();
        } else {
            // postgres only warns when there is no transaction to roll back
            rollback = connection.query("ROLLBACK").execute().mapEmpty();
        }
        return toCompletableFuture(rollback
                .recover(e -> Future.failedFuture(new LockConnectionException("Rollback failed", e))));
    }

    private Future<Object> queryValue(String query, LockRequest request) {
        Tuple tuple = Tuple.tuple();
        for (Object parameter : request.getEncodedKey().getParameters()) {
            if (parameter instanceof Long) {
                tuple.addLong((Long) parameter);
            } else {
                tuple.addInteger((Integer) parameter);
            }
        }

        return connection.preparedQuery(query).execute(tuple)
                .map(rows -> {
                    RowIterator<Row> iterator = rows.iterator();
                    return iterator.hasNext() ? iterator.next().getValue(0) : null;
                })
                .recover(e -> Future.failedFuture(
                        new LockConnectionException(format("Error while executing '%s' for key %s", query, request.getKey()), e)));
    }

    private static <T> CompletableFuture<T> toCompletableFuture(Future<T> future) {
        return future.toCompletionStage().toCompletableFuture();
    }

    private static String placeholder(int index) {
        return "$" + (index + 1);
    }
}
