package org.pglock.r2dbc;

import io.r2dbc.spi.Connection;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import io.r2dbc.spi.Result;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import io.r2dbc.spi.Statement;
import org.pglock.spi.EncodedKey;
import org.pglock.spi.LockRequest;
import org.pglock.spi.LockScope;
import org.pglock.util.LockConnectionException;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletionException;
import java.util.function.BiFunction;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

public class TestR2dbcLockInterface {
    private static final LockRequest SESSION = new LockRequest("k1", EncodedKey.bigint(42L), LockScope.SESSION, false);
    private static final LockRequest PAIR = new LockRequest("k1", EncodedKey.intPair(1, 2), LockScope.TRANSACTION, false);

    private Connection connection;
    private Statement statement;
    private Result result;
    private Row row;
    private R2dbcLockInterface lockInterface;

    @BeforeMethod
    @SuppressWarnings("unchecked")
    public void setUp() {
        connection = mock(Connection.class);
        statement = mock(Statement.class);
        result = mock(Result.class);
        row = mock(Row.class);
        when(connection.createStatement(anyString())).thenReturn(statement);
        doReturn(Mono.just(result)).when(statement).execute();
        when(result.map(any(BiFunction.class))).thenAnswer(invocation -> {
            BiFunction<Row, RowMetadata, ?> mapper = invocation.getArgument(0);
            return Flux.just(mapper.apply(row, mock(RowMetadata.class)));
        });
        when(result.getRowsUpdated()).thenReturn(Mono.just(1L));
        lockInterface = new R2dbcLockInterface(connection);
    }

    @Test
    public void testTryAcquire() {
        when(row.get(0, Boolean.class)).thenReturn(true);

        assertTrue(lockInterface.tryAcquire(SESSION));

        verify(connection).createStatement("SELECT pg_catalog.pg_try_advisory_lock($1)");
        verify(statement).bind(0, (Object) 42L);
    }

    @Test
    public void testTryAcquireAsyncRefused() {
        when(row.get(0, Boolean.class)).thenReturn(false);

        assertFalse(lockInterface.tryAcquireAsync(SESSION).join());
    }

    @Test
    public void testBlockAcquireDoesNotDecodeVoid() {
        lockInterface.blockAcquireAsync(PAIR).join();

        verify(connection).createStatement("SELECT pg_catalog.pg_advisory_xact_lock($1, $2)");
        verify(statement).bind(0, (Object) 1);
        verify(statement).bind(1, (Object) 2);
        verify(result).getRowsUpdated();
        verify(row, never()).get(0, Boolean.class);
    }

    @Test
    public void testRelease() {
        when(row.get(0, Boolean.class)).thenReturn(true);

        assertTrue(lockInterface.release(SESSION));
        verify(connection).createStatement("SELECT pg_catalog.pg_advisory_unlock($1)");
    }

    @Test
    public void testReleaseOfUnknownResult() {
        when(row.get(0, Boolean.class)).thenReturn(null);

        assertFalse(lockInterface.releaseAsync(SESSION).join());
    }

    @Test
    public void testReleaseTransactionScopeIsNoop() {
        assertFalse(lockInterface.release(PAIR));

        verify(connection, never()).createStatement(anyString());
    }

    @Test
    public void testRollback() {
        when(connection.isAutoCommit()).thenReturn(false);
        when(connection.rollbackTransaction()).thenReturn(Mono.empty());

        lockInterface.rollback();

        verify(connection).rollbackTransaction();
    }

    @Test
    public void testRollbackWithoutTransaction() {
        when(connection.isAutoCommit()).thenReturn(true);

        lockInterface.rollbackAsync().join();

        verify(connection, never()).rollbackTransaction();
    }

    @Test
    public void testFailureIsWrapped() {
        R2dbcNonTransientResourceException failure = new R2dbcNonTransientResourceException("connection closed");
        doReturn(Mono.error(failure)).when(statement).execute();

        LockConnectionException e = expectThrows(LockConnectionException.class, () -> lockInterface.blockAcquire(SESSION));
        assertSame(e.getCause(), failure);

        CompletionException async = expectThrows(CompletionException.class, () -> lockInterface.tryAcquireAsync(SESSION).join());
        assertTrue(async.getCause() instanceof LockConnectionException);
        assertSame(async.getCause().getCause(), failure);
    }
}
