package io.b2mash.ismsp.store;

import io.b2mash.ismsp.exception.StorageException;
import java.sql.SQLException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

/**
 * Runs every store operation in a short-lived transaction: commit on success, roll back on any
 * exception. Lock contention is retried with backoff at the outermost call only; a call made while
 * a transaction is already open joins it and leaves retrying to the owner.
 */
@Component
public class StoreTemplate {

  private static final Logger log = LoggerFactory.getLogger(StoreTemplate.class);

  private final JdbcClient jdbc;
  private final TransactionTemplate transactionTemplate;
  private final RetryTemplate retryTemplate;

  public StoreTemplate(
      JdbcClient jdbc, TransactionTemplate transactionTemplate, RetryTemplate retryTemplate) {
    this.jdbc = jdbc;
    this.transactionTemplate = transactionTemplate;
    this.retryTemplate = retryTemplate;
  }

  public <T> T execute(String operation, StoreCallback<T> callback) {
    if (TransactionSynchronizationManager.isActualTransactionActive()) {
      return callback.doInStore(jdbc);
    }
    try {
      return retryTemplate.execute(
          context -> {
            if (context.getRetryCount() > 0) {
              log.debug(
                  "Retrying {} after contention (attempt {})",
                  operation,
                  context.getRetryCount() + 1);
            }
            return executeInTransaction(operation, callback);
          });
    } catch (StoreContentionException e) {
      log.warn("Giving up on {} after repeated lock contention", operation);
      throw new StorageException("Store is busy, " + operation + " did not complete", e);
    }
  }

  public void executeWithoutResult(String operation, Consumer<JdbcClient> action) {
    execute(
        operation,
        client -> {
          action.accept(client);
          return null;
        });
  }

  private <T> T executeInTransaction(String operation, StoreCallback<T> callback) {
    try {
      return transactionTemplate.execute(status -> callback.doInStore(jdbc));
    } catch (DataAccessException | TransactionException e) {
      if (isContention(e)) {
        throw new StoreContentionException("Lock contention during " + operation, e);
      }
      log.error("Store operation {} failed", operation, e);
      throw new StorageException(operation + " failed: " + rootMessage(e), e);
    }
  }

  static boolean isContention(Throwable e) {
    if (e instanceof PessimisticLockingFailureException) {
      return true;
    }
    for (Throwable cause = e; cause != null; cause = cause.getCause()) {
      if (cause instanceof SQLiteException sqlite) {
        var code = sqlite.getResultCode();
        return isBusyOrLocked(code);
      }
      if (cause instanceof SQLException sql && sql.getMessage() != null) {
        var message = sql.getMessage();
        if (message.contains("SQLITE_BUSY") || message.contains("SQLITE_LOCKED")) {
          return true;
        }
      }
    }
    return false;
  }

  private static boolean isBusyOrLocked(SQLiteErrorCode code) {
    // Extended result codes keep the primary code in the low byte.
    int primary = code.code & 0xff;
    return primary == SQLiteErrorCode.SQLITE_BUSY.code
        || primary == SQLiteErrorCode.SQLITE_LOCKED.code;
  }

  private static String rootMessage(Throwable e) {
    Throwable root = e;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
  }
}
