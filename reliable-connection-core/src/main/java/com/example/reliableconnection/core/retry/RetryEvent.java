package com.example.reliableconnection.core.retry;

import com.example.reliableconnection.core.spi.DbCommand;

/**
 * Describes a retry that is about to happen.
 *
 * @param error the transient failure that triggered the retry
 * @param commandContext the command being executed, or {@code null} for connection operations
 * @param attempt the attempt that just failed; zero is the first attempt
 */
public record RetryEvent(Throwable error, DbCommand commandContext, int attempt) {}
