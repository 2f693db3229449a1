/**
 * Connection and command decorators that run database work under a {@link
 * com.example.reliableconnection.core.retry.RetryStrategy}.
 *
 * <ul>
 *   <li>{@link com.example.reliableconnection.core.WrappedConnection} and {@link
 *       com.example.reliableconnection.core.WrappedCommand} forward every call and track which
 *       transaction the connection owns.
 *   <li>{@link com.example.reliableconnection.core.ReliableConnection} and {@link
 *       com.example.reliableconnection.core.ReliableCommand} retry opens and executes, reopening
 *       the connection between attempts.
 * </ul>
 *
 * <pre>{@code
 * try (var connection = ReliableConnection.open(
 *         JdbcConnection.fromDataSource(dataSource), new RetryExecutor(RetryPolicy.defaults()));
 *     var command = connection.createCommand()) {
 *   command.setCommandText("UPDATE orders SET status = ? WHERE id = ?");
 *   command.getParameters().add(new DbParameter("status", "SHIPPED"));
 *   command.getParameters().add(new DbParameter("id", 42L));
 *   command.executeNonQuery();
 * }
 * }</pre>
 */
package com.example.reliableconnection.core;
