package com.example.reliableconnection.core.jdbc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.reliableconnection.core.spi.IsolationLevel;
import java.sql.Connection;
import java.sql.SQLException;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class JdbcTransactionTest {

  private Connection physical;
  private JdbcConnection owner;

  @BeforeEach
  void setUp() throws SQLException {
    physical = mock(Connection.class);
    when(physical.getAutoCommit()).thenReturn(true);
    when(physical.getTransactionIsolation()).thenReturn(Connection.TRANSACTION_READ_COMMITTED);
    owner = JdbcConnection.of(() -> physical, Runnable::run);
    owner.open();
  }

  @Test
  @DisplayName("Should switch auto-commit off and apply the requested isolation")
  void shouldBegin() throws SQLException {
    final var transaction = owner.beginTransaction(IsolationLevel.SERIALIZABLE);

    verify(physical).setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
    verify(physical).setAutoCommit(false);
    assertEquals(IsolationLevel.SERIALIZABLE, transaction.getIsolationLevel());
    assertSame(owner, transaction.getConnection());
  }

  @Test
  @DisplayName("Should keep the current isolation when none is requested")
  void shouldKeepIsolation() throws SQLException {
    final var transaction = owner.beginTransaction(IsolationLevel.UNSPECIFIED);

    verify(physical, never()).setTransactionIsolation(anyInt());
    assertEquals(IsolationLevel.READ_COMMITTED, transaction.getIsolationLevel());
  }

  @Test
  @DisplayName("Should roll back uncommitted work and restore settings on close")
  void shouldRollbackOnClose() throws SQLException {
    final var transaction = owner.beginTransaction(IsolationLevel.SERIALIZABLE);
    when(physical.getTransactionIsolation()).thenReturn(Connection.TRANSACTION_SERIALIZABLE);

    transaction.close();

    verify(physical).rollback();
    verify(physical).setAutoCommit(true);
    verify(physical).setTransactionIsolation(Connection.TRANSACTION_READ_COMMITTED);
  }

  @Test
  @DisplayName("Should not roll back after commit")
  void shouldNotRollbackAfterCommit() throws SQLException {
    final var transaction = owner.beginTransaction(IsolationLevel.UNSPECIFIED);

    transaction.commit();
    transaction.close();

    verify(physical).commit();
    verify(physical, never()).rollback();
  }

  @Test
  @DisplayName("Should refuse to commit twice")
  void shouldRefuseSecondCommit() throws SQLException {
    final var transaction = owner.beginTransaction(IsolationLevel.UNSPECIFIED);
    transaction.rollback();

    assertThrows(IllegalStateException.class, transaction::commit);
    assertThrows(IllegalStateException.class, transaction::rollback);
  }

  @Test
  @DisplayName("Should skip cleanup when the physical connection is gone")
  void shouldSkipCleanupWhenReleased() throws SQLException {
    final var transaction = owner.beginTransaction(IsolationLevel.UNSPECIFIED);
    when(physical.isClosed()).thenReturn(true);

    transaction.close();
    transaction.close();

    verify(physical, never()).rollback();
  }

  @Test
  @DisplayName("Should only be active on the connection it began on")
  void shouldTrackPhysicalConnection() throws SQLException {
    final var transaction = (JdbcTransaction) owner.beginTransaction(IsolationLevel.UNSPECIFIED);

    assertTrue(transaction.isActiveOn(physical));
    assertFalse(transaction.isActiveOn(mock(Connection.class)));

    transaction.commit();
    assertFalse(transaction.isActiveOn(physical));
  }

  @Test
  @DisplayName("Should not survive a reconnect")
  void shouldNotSurviveReconnect() throws SQLException {
    assertFalse(owner.beginTransaction(IsolationLevel.UNSPECIFIED).survivesReconnect());
  }
}
