package com.example.reliableconnection.core.retry;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.reliableconnection.core.provider.ProviderRegistry;
import com.example.reliableconnection.core.spi.ConnectionState;
import com.example.reliableconnection.core.spi.DbCommand;
import com.example.reliableconnection.core.spi.DbConnection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class RetryExecutorTest {

  private static final FaultClassifier TRANSIENT_ONLY =
      FaultClassifier.custom(e -> e instanceof SQLTransientConnectionException);

  private List<Duration> sleeps;
  private List<Duration> scheduled;

  @BeforeEach
  void setUp() {
    sleeps = new ArrayList<>();
    scheduled = new ArrayList<>();
  }

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  private RetryExecutor executor(final RetryPolicy policy) {
    return RetryExecutor.builder()
        .policy(policy)
        .classifier(TRANSIENT_ONLY)
        .sleeper(sleeps::add)
        .scheduler(
            delay -> {
              scheduled.add(delay);
              return Runnable::run;
            })
        .build();
  }

  private static RetryPolicy threeRetries() {
    return RetryPolicy.builder()
        .maxRetryCount(3)
        .fastFirstRetry(true)
        .minBackoff(Duration.ofMillis(100))
        .incrementalBackoff(Duration.ofMillis(100))
        .maxBackoff(Duration.ofSeconds(1))
        .build();
  }

  private static SQLTransientConnectionException transientError(final int attempt) {
    return new SQLTransientConnectionException("connection dropped on attempt " + attempt, "08006");
  }

  @Nested
  @DisplayName("Synchronous Retry")
  class SynchronousRetry {

    @Test
    @DisplayName("Should succeed on the fourth attempt after waits of 0, 100ms and 200ms")
    void shouldRecoverAfterTransientFailures() throws SQLException {
      final var calls = new AtomicInteger();

      final var result =
          executor(threeRetries())
              .executeWithRetry(
                  null,
                  () -> {
                    final var attempt = calls.getAndIncrement();
                    if (attempt < 3) throw transientError(attempt);
                    return "ok";
                  });

      assertEquals("ok", result);
      assertEquals(4, calls.get());
      // the zero wait of the fast first retry does not sleep
      assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    @DisplayName("Should propagate the last attempt's error once retries are exhausted")
    void shouldPropagateLastError() {
      final var thrown = new ArrayList<SQLException>();

      final var error =
          assertThrows(
              SQLTransientConnectionException.class,
              () ->
                  executor(threeRetries())
                      .executeWithRetry(
                          null,
                          () -> {
                            final var e = transientError(thrown.size());
                            thrown.add(e);
                            throw e;
                          }));

      assertEquals(4, thrown.size());
      assertSame(thrown.get(3), error);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 5})
    @DisplayName("Should invoke an always-failing operation maxRetryCount + 1 times")
    void shouldInvokeOperationRetryCountPlusOne(final int maxRetryCount) {
      final var calls = new AtomicInteger();
      final var policy = RetryPolicy.builder().maxRetryCount(maxRetryCount).build();

      assertThrows(
          SQLException.class,
          () ->
              executor(policy)
                  .executeWithRetry(
                      null,
                      () -> {
                        throw transientError(calls.getAndIncrement());
                      }));

      assertEquals(maxRetryCount + 1, calls.get());
    }

    @Test
    @DisplayName("Should stop when the listener cancels the retry")
    void shouldStopWhenListenerCancels() {
      final var calls = new AtomicInteger();
      final var events = new ArrayList<RetryEvent>();
      final var policy =
          threeRetries()
              .withListener(
                  event -> {
                    events.add(event);
                    return true;
                  });
      final var first = transientError(0);

      final var error =
          assertThrows(
              SQLException.class,
              () ->
                  executor(policy)
                      .executeWithRetry(
                          null,
                          () -> {
                            calls.incrementAndGet();
                            throw first;
                          }));

      assertSame(first, error);
      assertEquals(1, calls.get());
      assertEquals(1, events.size());
      assertEquals(0, events.get(0).attempt());
      assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Should not retry a failure that is not transient")
    void shouldNotRetryPermanentFailure() {
      final var calls = new AtomicInteger();
      final var permanent = new SQLException("syntax error", "42601");

      final var error =
          assertThrows(
              SQLException.class,
              () ->
                  executor(threeRetries())
                      .executeWithRetry(
                          null,
                          () -> {
                            calls.incrementAndGet();
                            throw permanent;
                          }));

      assertSame(permanent, error);
      assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Should retry unchecked failures the classifier accepts")
    void shouldRetryRuntimeFailures() throws SQLException {
      final var calls = new AtomicInteger();
      final var executor =
          RetryExecutor.builder()
              .policy(threeRetries())
              .classifier(FaultClassifier.custom(e -> e instanceof IllegalStateException))
              .sleeper(sleeps::add)
              .build();

      final var result =
          executor.executeWithRetry(
              null,
              () -> {
                if (calls.getAndIncrement() == 0) throw new IllegalStateException("pool busy");
                return 42;
              });

      assertEquals(42, result);
      assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("Should report attempts 0, 1, 2 with the command context to the listener")
    void shouldReportAttemptsToListener() throws SQLException {
      final var command = mock(DbCommand.class);
      final var attempts = new ArrayList<Integer>();
      final var policy =
          threeRetries()
              .withListener(
                  event -> {
                    assertSame(command, event.commandContext());
                    assertInstanceOf(SQLTransientConnectionException.class, event.error());
                    attempts.add(event.attempt());
                    return false;
                  });
      final var calls = new AtomicInteger();

      executor(policy)
          .executeWithRetry(
              command,
              () -> {
                final var attempt = calls.getAndIncrement();
                if (attempt < 3) throw transientError(attempt);
                return null;
              });

      assertEquals(List.of(0, 1, 2), attempts);
    }

    @Test
    @DisplayName("Should wait from the first retry without fastFirstRetry and cap at maxBackoff")
    void shouldHonourSlowFirstRetryAndCap() {
      final var policy =
          RetryPolicy.builder()
              .fastFirstRetry(false)
              .maxRetryCount(4)
              .maxBackoff(Duration.ofMillis(250))
              .build();

      assertThrows(
          SQLException.class,
          () ->
              executor(policy)
                  .executeWithRetry(
                      null,
                      () -> {
                        throw transientError(0);
                      }));

      assertEquals(
          List.of(
              Duration.ofMillis(100),
              Duration.ofMillis(200),
              Duration.ofMillis(250),
              Duration.ofMillis(250)),
          sleeps);
    }

    @Test
    @DisplayName("Should propagate the error and keep the interrupt flag when interrupted")
    void shouldStopWhenInterrupted() {
      final var calls = new AtomicInteger();
      final var policy = RetryPolicy.builder().fastFirstRetry(false).build();
      final var executor =
          RetryExecutor.builder()
              .policy(policy)
              .classifier(TRANSIENT_ONLY)
              .sleeper(
                  delay -> {
                    throw new InterruptedException();
                  })
              .build();
      final var failure = transientError(0);

      final var error =
          assertThrows(
              SQLException.class,
              () ->
                  executor.executeWithRetry(
                      null,
                      () -> {
                        calls.incrementAndGet();
                        throw failure;
                      }));

      assertSame(failure, error);
      assertEquals(1, calls.get());
      assertTrue(Thread.currentThread().isInterrupted());
    }
  }

  @Nested
  @DisplayName("Provider Classification")
  class ProviderClassification {

    @Test
    @DisplayName("Should run a permanent failure once even when its message names a pool")
    void shouldNotRetryPermanentStateWithKeyword() {
      final var calls = new AtomicInteger();
      final var executor =
          RetryExecutor.builder()
              .policy(threeRetries())
              .classifier(ProviderRegistry.withBuiltIns())
              .sleeper(sleeps::add)
              .build();
      final var missingColumn = new SQLException("column \"pool_size\" does not exist", "42703");

      final var error =
          assertThrows(
              SQLException.class,
              () ->
                  executor.executeWithRetry(
                      null,
                      () -> {
                        calls.incrementAndGet();
                        throw missingColumn;
                      }));

      assertSame(missingColumn, error);
      assertEquals(1, calls.get());
      assertTrue(sleeps.isEmpty());
    }
  }

  @Nested
  @DisplayName("Command Context")
  class CommandContext {

    private DbCommand command;
    private DbConnection connection;

    @BeforeEach
    void setUp() {
      command = mock(DbCommand.class);
      connection = mock(DbConnection.class);
      when(command.getConnection()).thenReturn(connection);
    }

    @Test
    @DisplayName("Should disconnect an open connection before each retry")
    void shouldDisconnectBeforeRetry() throws SQLException {
      when(connection.getState()).thenReturn(ConnectionState.OPEN);
      final var calls = new AtomicInteger();

      executor(threeRetries())
          .executeWithRetry(
              command,
              () -> {
                final var attempt = calls.getAndIncrement();
                if (attempt < 2) throw transientError(attempt);
                return 1;
              });

      verify(connection, times(2)).disconnect();
    }

    @Test
    @DisplayName("Should leave an already closed connection alone")
    void shouldNotDisconnectClosedConnection() throws SQLException {
      when(connection.getState()).thenReturn(ConnectionState.CLOSED);
      final var calls = new AtomicInteger();

      executor(threeRetries())
          .executeWithRetry(
              command,
              () -> {
                if (calls.getAndIncrement() == 0) throw transientError(0);
                return 1;
              });

      verify(connection, never()).disconnect();
    }

    @Test
    @DisplayName("Should run once when the command uses a caller-owned transaction")
    void shouldNotRetryInsideExternalTransaction() throws SQLException {
      when(command.hasExternalTransaction()).thenReturn(true);
      final var calls = new AtomicInteger();
      final var failure = transientError(0);

      final var error =
          assertThrows(
              SQLException.class,
              () ->
                  executor(threeRetries())
                      .executeWithRetry(
                          command,
                          () -> {
                            calls.incrementAndGet();
                            throw failure;
                          }));

      assertSame(failure, error);
      assertEquals(1, calls.get());
      verify(connection, never()).disconnect();
    }

    @Test
    @DisplayName("Should keep the original error when disconnecting fails")
    void shouldSuppressDisconnectFailure() throws SQLException {
      when(connection.getState()).thenReturn(ConnectionState.BROKEN);
      final var disconnectFailure = new SQLException("already gone");
      doThrow(disconnectFailure).when(connection).disconnect();
      final var failure = transientError(0);

      final var error =
          assertThrows(
              SQLException.class,
              () ->
                  executor(threeRetries())
                      .executeWithRetry(
                          command,
                          () -> {
                            throw failure;
                          }));

      assertSame(failure, error);
      assertArrayEquals(new Throwable[] {disconnectFailure}, error.getSuppressed());
    }
  }

  @Nested
  @DisplayName("Asynchronous Retry")
  class AsynchronousRetry {

    @Test
    @DisplayName("Should succeed after transient failures using scheduled waits")
    void shouldRecoverAsync() throws Exception {
      final var calls = new AtomicInteger();

      final var result =
          executor(threeRetries())
              .executeWithRetryAsync(
                  null,
                  () -> {
                    final var attempt = calls.getAndIncrement();
                    return attempt < 3
                        ? CompletableFuture.failedFuture(transientError(attempt))
                        : CompletableFuture.completedFuture("ok");
                  });

      assertEquals("ok", result.get(1, TimeUnit.SECONDS));
      assertEquals(4, calls.get());
      assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), scheduled);
    }

    @Test
    @DisplayName("Should fail with the last attempt's error, unwrapped")
    void shouldFailWithLastError() {
      final var thrown = new ArrayList<SQLException>();

      final var result =
          executor(threeRetries())
              .executeWithRetryAsync(
                  null,
                  () -> {
                    final var e = transientError(thrown.size());
                    thrown.add(e);
                    return CompletableFuture.supplyAsync(
                        () -> {
                          throw new CompletionException(e);
                        },
                        Runnable::run);
                  });

      final var error = assertThrows(ExecutionException.class, result::get);
      assertEquals(4, thrown.size());
      assertSame(thrown.get(3), error.getCause());
    }

    @Test
    @DisplayName("Should fail when starting an attempt throws")
    void shouldFailWhenStartThrows() {
      final var failure = new SQLException("cannot start");

      final var result =
          executor(threeRetries())
              .executeWithRetryAsync(
                  null,
                  () -> {
                    throw failure;
                  });

      assertTrue(result.isCompletedExceptionally());
      final var error = assertThrows(ExecutionException.class, result::get);
      assertSame(failure, error.getCause());
    }

    @Test
    @DisplayName("Should fail when an attempt returns no future")
    void shouldFailOnNullFuture() {
      final var result = executor(threeRetries()).executeWithRetryAsync(null, () -> null);

      final var error = assertThrows(ExecutionException.class, result::get);
      assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    @DisplayName("Should fail with the listener's exception when the listener throws")
    void shouldFailWhenListenerThrows() {
      final var listenerFailure = new IllegalStateException("listener broke");
      final var policy =
          threeRetries()
              .withListener(
                  event -> {
                    throw listenerFailure;
                  });

      final var result =
          executor(policy)
              .executeWithRetryAsync(
                  null, () -> CompletableFuture.failedFuture(transientError(0)));

      final var error = assertThrows(ExecutionException.class, result::get);
      assertSame(listenerFailure, error.getCause());
    }

    @Test
    @DisplayName("Should cancel the result when an attempt is cancelled")
    void shouldPropagateCancellation() {
      final var result =
          executor(threeRetries())
              .executeWithRetryAsync(
                  null,
                  () -> {
                    final var attempt = new CompletableFuture<String>();
                    attempt.cancel(false);
                    return attempt;
                  });

      assertTrue(result.isCancelled());
    }

    @Test
    @DisplayName("Should not start a pending retry after the caller cancels")
    void shouldSkipPendingRetryAfterCallerCancels() {
      final var pending = new ArrayList<Runnable>();
      final var calls = new AtomicInteger();
      final var executor =
          RetryExecutor.builder()
              .policy(threeRetries().toBuilder().fastFirstRetry(false).build())
              .classifier(TRANSIENT_ONLY)
              .scheduler(delay -> pending::add)
              .build();

      final var result =
          executor.executeWithRetryAsync(
              null,
              () ->
                  CompletableFuture.failedFuture(transientError(calls.getAndIncrement())));

      assertEquals(1, pending.size());
      result.cancel(false);
      pending.get(0).run();

      assertEquals(1, calls.get());
      assertTrue(result.isCancelled());
    }

    @Test
    @DisplayName("Should not retry inside a caller-owned transaction")
    void shouldNotRetryExternalTransactionAsync() {
      final var command = mock(DbCommand.class);
      when(command.hasExternalTransaction()).thenReturn(true);
      final var calls = new AtomicInteger();

      final var result =
          executor(threeRetries())
              .executeWithRetryAsync(
                  command,
                  () -> {
                    calls.incrementAndGet();
                    return CompletableFuture.failedFuture(transientError(0));
                  });

      assertThrows(ExecutionException.class, result::get);
      assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Should wait on the default scheduler without blocking the caller")
    void shouldRetryOnDefaultScheduler() throws Exception {
      final var policy =
          RetryPolicy.builder()
              .fastFirstRetry(false)
              .maxRetryCount(2)
              .minBackoff(Duration.ofMillis(1))
              .incrementalBackoff(Duration.ofMillis(1))
              .build();
      final var executor = new RetryExecutor(policy, TRANSIENT_ONLY);
      final var calls = new AtomicInteger();

      final var result =
          executor.executeWithRetryAsync(
              null,
              () ->
                  calls.getAndIncrement() < 2
                      ? CompletableFuture.failedFuture(transientError(0))
                      : CompletableFuture.completedFuture(7));

      assertEquals(7, result.get(5, TimeUnit.SECONDS));
      assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("Should run delayed retries on the executor given to the scheduler")
    void shouldRetryOnSuppliedExecutor() throws Exception {
      final var handoffs = new AtomicInteger();
      final var executor =
          RetryExecutor.builder()
              .policy(
                  RetryPolicy.builder()
                      .fastFirstRetry(false)
                      .maxRetryCount(2)
                      .minBackoff(Duration.ofMillis(1))
                      .incrementalBackoff(Duration.ofMillis(1))
                      .build())
              .classifier(TRANSIENT_ONLY)
              .scheduler(
                  RetryExecutor.DelayScheduler.using(
                      task -> {
                        handoffs.incrementAndGet();
                        task.run();
                      }))
              .build();
      final var calls = new AtomicInteger();

      final var result =
          executor.executeWithRetryAsync(
              null,
              () ->
                  calls.getAndIncrement() < 2
                      ? CompletableFuture.failedFuture(transientError(0))
                      : CompletableFuture.completedFuture("shipped"));

      assertEquals("shipped", result.get(5, TimeUnit.SECONDS));
      assertEquals(3, calls.get());
      assertEquals(2, handoffs.get());
    }

    @Test
    @DisplayName("Should reject a null scheduler executor")
    void shouldRejectNullSchedulerExecutor() {
      assertThrows(NullPointerException.class, () -> RetryExecutor.DelayScheduler.using(null));
    }

    @ParameterizedTest
    @MethodSource("com.example.reliableconnection.core.retry.RetryExecutorTest#outcomes")
    @DisplayName("Should settle the result exactly once")
    void shouldSettleExactlyOnce(final int failures, final boolean vetoAfterFirst)
        throws Exception {
      final var settlements = new AtomicInteger();
      final var policy =
          threeRetries().withListener(event -> vetoAfterFirst && event.attempt() > 0);
      final var calls = new AtomicInteger();

      final var result =
          executor(policy)
              .executeWithRetryAsync(
                  null,
                  () ->
                      calls.getAndIncrement() < failures
                          ? CompletableFuture.failedFuture(transientError(calls.get()))
                          : CompletableFuture.completedFuture("done"));
      result.whenComplete((value, error) -> settlements.incrementAndGet());

      assertTrue(result.isDone());
      assertEquals(1, settlements.get());
      final var expectedCalls = Math.min(failures + 1, vetoAfterFirst ? 2 : 4);
      assertEquals(expectedCalls, calls.get());
    }
  }

  static Stream<Arguments> outcomes() {
    return Stream.of(
        Arguments.of(0, false),
        Arguments.of(2, false),
        Arguments.of(5, false),
        Arguments.of(0, true),
        Arguments.of(3, true));
  }

  @Nested
  @DisplayName("Builder")
  class BuilderTests {

    @Test
    @DisplayName("Should reject a missing policy")
    void shouldRejectMissingPolicy() {
      assertThrows(IllegalStateException.class, () -> RetryExecutor.builder().policy(null).build());
    }

    @Test
    @DisplayName("Should default to the shared provider registry")
    void shouldDefaultClassifier() {
      final var executor = RetryExecutor.builder().build();

      assertNotNull(executor.classifier());
      assertEquals(RetryPolicy.defaults(), executor.policy());
    }
  }
}
