package com.example.reliableconnection.core.jdbc;

import com.example.reliableconnection.core.spi.CommandBehavior;
import com.example.reliableconnection.core.spi.CommandType;
import com.example.reliableconnection.core.spi.DbCommand;
import com.example.reliableconnection.core.spi.DbParameter;
import com.example.reliableconnection.core.spi.DbTransaction;
import com.example.reliableconnection.core.spi.ParameterDirection;
import com.example.reliableconnection.core.spi.StreamParameterValue;
import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link DbCommand} over JDBC statements.
 *
 * <ul>
 *   <li>{@link CommandType#TEXT} runs the command text as a {@link PreparedStatement} with {@code
 *       ?} placeholders bound from the parameters in list order.
 *   <li>{@link CommandType#STORED_PROCEDURE} treats the command text as a procedure name and calls
 *       it through a {@link CallableStatement}. A {@link ParameterDirection#RETURN_VALUE} parameter
 *       is bound first, as in {@code {? = call name(?, ?)}}.
 * </ul>
 *
 * <p>Output parameters need an {@code sqlType}; their values are copied back into the parameter
 * list after {@link #executeNonQuery()} and {@link #executeScalar()}.
 */
public final class JdbcCommand implements DbCommand {

  private final JdbcConnection connection;
  private final List<DbParameter> parameters = new ArrayList<>();
  private String commandText;
  private CommandType commandType = CommandType.TEXT;
  private int commandTimeout;
  private JdbcTransaction transaction;

  private PreparedStatement prepared;
  private Connection preparedOn;
  private String preparedSql;
  private volatile PreparedStatement running;

  JdbcCommand(final JdbcConnection connection) {
    this.connection = connection;
  }

  @Override
  public String getCommandText() {
    return commandText;
  }

  @Override
  public void setCommandText(final String commandText) {
    this.commandText = commandText;
  }

  @Override
  public CommandType getCommandType() {
    return commandType;
  }

  @Override
  public void setCommandType(final CommandType commandType) {
    this.commandType = Objects.requireNonNull(commandType, "commandType");
  }

  @Override
  public int getCommandTimeout() {
    return commandTimeout;
  }

  @Override
  public void setCommandTimeout(final int seconds) {
    if (seconds < 0) throw new IllegalArgumentException("commandTimeout must be >= 0");
    this.commandTimeout = seconds;
  }

  @Override
  public List<DbParameter> getParameters() {
    return parameters;
  }

  @Override
  public DbTransaction getTransaction() {
    return transaction;
  }

  /**
   * Binds a transaction begun by a {@link JdbcConnection}.
   *
   * @throws IllegalArgumentException for transactions from another kind of connection
   */
  @Override
  public void setTransaction(final DbTransaction transaction) {
    if (transaction != null && !(transaction instanceof JdbcTransaction))
      throw new IllegalArgumentException(
          "Unsupported transaction type " + transaction.getClass().getName());
    this.transaction = (JdbcTransaction) transaction;
  }

  @Override
  public JdbcConnection getConnection() {
    return connection;
  }

  @Override
  public int executeNonQuery() throws SQLException {
    return execute(
        statement -> {
          statement.execute();
          return statement.getUpdateCount();
        });
  }

  @Override
  public Object executeScalar() throws SQLException {
    return execute(
        statement -> {
          var hasResultSet = statement.execute();
          while (!hasResultSet && statement.getUpdateCount() != -1)
            hasResultSet = statement.getMoreResults();
          if (!hasResultSet) return null;

          try (final var rs = statement.getResultSet()) {
            return rs.next() ? rs.getObject(1) : null;
          }
        });
  }

  /**
   * Executes the command and returns its rows. Closing the result set closes the statement.
   *
   * @param behavior {@link CommandBehavior#SINGLE_ROW} limits the result to one row
   */
  @Override
  public ResultSet executeReader(final CommandBehavior behavior) throws SQLException {
    final var physical = physicalConnection();
    final var ordered = orderedParameters();
    final var sql = jdbcSql(ordered);

    var statement = takePrepared(physical, sql);
    if (statement == null) statement = createStatement(physical, sql);
    try {
      bind(statement, ordered);
      if (behavior == CommandBehavior.SINGLE_ROW) statement.setMaxRows(1);
      running = statement;
      final var rs = statement.executeQuery();
      statement.closeOnCompletion();
      return rs;
    } catch (final SQLException | RuntimeException e) {
      closeAfterFailure(statement, e);
      throw e;
    } finally {
      running = null;
    }
  }

  /** Creates the statement now, so the next execution on the same physical connection reuses it. */
  @Override
  public void prepare() throws SQLException {
    final var physical = physicalConnection();
    final var sql = jdbcSql(orderedParameters());
    discardPrepared();
    prepared = createStatement(physical, sql);
    preparedOn = physical;
    preparedSql = sql;
  }

  @Override
  public CompletableFuture<Integer> executeNonQueryAsync() {
    return connection.supplyAsync(this::executeNonQuery);
  }

  @Override
  public CompletableFuture<ResultSet> executeReaderAsync(final CommandBehavior behavior) {
    return connection.supplyAsync(() -> executeReader(behavior));
  }

  @Override
  public CompletableFuture<Object> executeScalarAsync() {
    return connection.supplyAsync(this::executeScalar);
  }

  @Override
  public void cancel() throws SQLException {
    final var statement = running;
    if (statement != null) statement.cancel();
  }

  @Override
  public void close() throws SQLException {
    discardPrepared();
  }

  private <T> T execute(final StatementWork<T> work) throws SQLException {
    final var physical = physicalConnection();
    final var ordered = orderedParameters();
    final var sql = jdbcSql(ordered);

    final var cached = cachedPrepared(physical, sql);
    final var statement = cached != null ? cached : createStatement(physical, sql);
    try {
      statement.clearParameters();
      bind(statement, ordered);
      running = statement;
      final var result = work.run(statement);
      readOutputs(statement, ordered);
      return result;
    } finally {
      running = null;
      if (cached == null) statement.close();
    }
  }

  private Connection physicalConnection() throws SQLException {
    final var physical = connection.requireOpen();
    if (transaction != null && !transaction.isActiveOn(physical))
      throw new SQLException("Transaction is no longer active on this connection", "25000");
    return physical;
  }

  private List<DbParameter> orderedParameters() {
    final var ordered = new ArrayList<DbParameter>(parameters.size());
    for (final var parameter : parameters)
      if (parameter.getDirection() == ParameterDirection.RETURN_VALUE) ordered.add(0, parameter);
      else ordered.add(parameter);
    return ordered;
  }

  private String jdbcSql(final List<DbParameter> ordered) {
    if (commandText == null || commandText.isBlank())
      throw new IllegalStateException("commandText has not been set");
    if (commandType == CommandType.TEXT) return commandText;

    final var hasReturn =
        !ordered.isEmpty() && ordered.get(0).getDirection() == ParameterDirection.RETURN_VALUE;
    final var arguments = hasReturn ? ordered.size() - 1 : ordered.size();

    final var sql = new StringBuilder(hasReturn ? "{? = call " : "{call ").append(commandText);
    sql.append('(');
    for (var i = 0; i < arguments; i++) sql.append(i == 0 ? "?" : ", ?");
    return sql.append(")}").toString();
  }

  private PreparedStatement createStatement(final Connection physical, final String sql)
      throws SQLException {
    final var statement =
        commandType == CommandType.STORED_PROCEDURE
            ? physical.prepareCall(sql)
            : physical.prepareStatement(sql);
    if (commandTimeout > 0) statement.setQueryTimeout(commandTimeout);
    return statement;
  }

  private PreparedStatement cachedPrepared(final Connection physical, final String sql)
      throws SQLException {
    if (prepared == null) return null;
    if (preparedOn == physical && sql.equals(preparedSql) && !prepared.isClosed()) return prepared;
    discardPrepared();
    return null;
  }

  private PreparedStatement takePrepared(final Connection physical, final String sql)
      throws SQLException {
    final var statement = cachedPrepared(physical, sql);
    prepared = null;
    preparedOn = null;
    preparedSql = null;
    return statement;
  }

  private void discardPrepared() throws SQLException {
    final var statement = prepared;
    final var physical = preparedOn;
    prepared = null;
    preparedOn = null;
    preparedSql = null;
    // statements of a released connection went away with it
    if (statement != null && !physical.isClosed()) statement.close();
  }

  private static void bind(final PreparedStatement statement, final List<DbParameter> ordered)
      throws SQLException {
    for (var i = 0; i < ordered.size(); i++) {
      final var parameter = ordered.get(i);
      final var index = i + 1;

      if (parameter.getDirection().isOutput()) {
        if (!(statement instanceof CallableStatement))
          throw new SQLException(
              "Output parameter " + parameter.getName() + " requires a stored procedure command");
        if (parameter.getSqlType() == null)
          throw new SQLException("Output parameter " + parameter.getName() + " needs an sqlType");
        ((CallableStatement) statement).registerOutParameter(index, parameter.getSqlType());
      }

      if (parameter.getDirection().isInput()) bindValue(statement, index, parameter);
    }
  }

  private static void bindValue(
      final PreparedStatement statement, final int index, final DbParameter parameter)
      throws SQLException {
    final var value = parameter.getValue();
    final var sqlType = parameter.getSqlType();

    if (value instanceof StreamParameterValue)
      statement.setBinaryStream(index, ((StreamParameterValue) value).stream());
    else if (value == null) statement.setNull(index, sqlType != null ? sqlType : Types.NULL);
    else if (sqlType != null) statement.setObject(index, value, sqlType);
    else statement.setObject(index, value);
  }

  private static void readOutputs(
      final PreparedStatement statement, final List<DbParameter> ordered) throws SQLException {
    if (!(statement instanceof CallableStatement)) return;

    final var callable = (CallableStatement) statement;
    for (var i = 0; i < ordered.size(); i++) {
      final var parameter = ordered.get(i);
      if (parameter.getDirection().isOutput()) parameter.setValue(callable.getObject(i + 1));
    }
  }

  private static void closeAfterFailure(
      final PreparedStatement statement, final Exception failure) {
    try {
      statement.close();
    } catch (final SQLException e) {
      failure.addSuppressed(e);
    }
  }

  @FunctionalInterface
  private interface StatementWork<T> {
    T run(PreparedStatement statement) throws SQLException;
  }
}
