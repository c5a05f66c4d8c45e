package org.pglock.r2dbc;

import io.airlift.log.Logger;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.R2dbcException;
import io.r2dbc.spi.Result;
import io.r2dbc.spi.Statement;
import org.pglock.spi.LockInterface;
import org.pglock.spi.LockInterfaceType;
import org.pglock.spi.LockRequest;
import org.pglock.util.LockConnectionException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.String.format;

/**
 * Lock calls through an R2DBC {@link Connection}. The blocking operations subscribe and wait
 * on the calling thread, so they must not be used from a reactive scheduler thread.
 */
public class R2dbcLockInterface
        implements LockInterface {
    private static final Logger log = Logger.get(R2dbcLockInterface.class);

    private final Connection connection;

    public R2dbcLockInterface(Connection connection) {
        this.connection = checkNotNull(connection, "connection is null");
    }

    @Override
    public LockInterfaceType getType() {
        return LockInterfaceType.R2DBC;
    }

    @Override
    public boolean tryAcquire(LockRequest request) {
        return tryAcquireMono(request).block();
    }

    @Override
    public void blockAcquire(LockRequest request) {
        blockAcquireMono(request).block();
    }

    @Override
    public boolean release(LockRequest request) {
        return releaseMono(request).block();
    }

    @Override
    public void rollback() {
        rollbackMono().block();
    }

    @Override
    public CompletableFuture<Boolean> tryAcquireAsync(LockRequest request) {
        return tryAcquireMono(request).toFuture();
    }

    @Override
    public CompletableFuture<Void> blockAcquireAsync(LockRequest request) {
        return blockAcquireMono(request).toFuture();
    }

    @Override
    public CompletableFuture<Boolean> releaseAsync(LockRequest request) {
        return releaseMono(request).toFuture();
    }

    @Override
    public CompletableFuture<Void> rollbackAsync() {
        return rollbackMono().toFuture();
    }

    public Mono<Boolean> tryAcquireMono(LockRequest request) {
        String query = request.lockStatement(false, R2dbcLockInterface::placeholder);
        // only a literal false means the lock is taken
        return queryBoolean(query, request).map(value -> value.orElse(Boolean.TRUE));
    }

    public Mono<Void> blockAcquireMono(LockRequest request) {
        String query = request.lockStatement(true, R2dbcLockInterface::placeholder);
        return Mono.defer(() -> {
            log.debug("Acquire statement for key: %s, %s", request.getKey(), query);
            return Flux.from(statement(query, request).execute())
                    .concatMap(Result::getRowsUpdated)
                    .then();
        }).onErrorMap(R2dbcException.class, e -> failure(query, request, e));
    }

    public Mono<Boolean> releaseMono(LockRequest request) {
        if (request.isTransactionScoped()) {
            return Mono.just(false);
        }
        String query = request.unlockStatement(R2dbcLockInterface::placeholder);
        return queryBoolean(query, request).map(value -> value.orElse(Boolean.FALSE));
    }

    public Mono<Void> rollbackMono() {
        return Mono.defer(() -> {
            if (connection.isAutoCommit()) {
                return Mono.<Void>empty();
            }
            return Mono.from(connection.rollbackTransaction());
        }).onErrorMap(R2dbcException.class, e -> new LockConnectionException("Rollback failed", e));
    }

    private Mono<Optional<Boolean>> queryBoolean(String query, LockRequest request) {
        return Mono.defer(() -> {
            log.debug("Statement for key: %s, %s", request.getKey(), query);
            return Flux.from(statement(query, request).execute())
                    .concatMap(result -> result.map((row, metadata) -> Optional.ofNullable(row.get(0, Boolean.class))))
                    .next()
                    .defaultIfEmpty(Optional.empty());
        }).onErrorMap(R2dbcException.class, e -> failure(query, request, e));
    }

    private Statement statement(String query, LockRequest request) {
        Statement statement = connection.createStatement(query);
        List<Object> parameters = request.getEncodedKey().getParameters();
        for (int i = 0; i < parameters.size(); i++) {
            statement.bind(i, parameters.get(i));
        }
        return statement;
    }

    private static LockConnectionException failure(String query, LockRequest request, Throwable e) {
        return new LockConnectionException(format("Error while executing '%s' for key %s", query, request.getKey()), e);
    }

    private static String placeholder(int index) {
        return "$" + (index + 1);
    }
}
