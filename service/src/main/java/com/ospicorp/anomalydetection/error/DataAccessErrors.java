package com.ospicorp.anomalydetection.error;

import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

/** Classifies relational-store failures that callers should retry later. */
public final class DataAccessErrors {
  public static final int RETRY_AFTER_SECONDS = 1;

  private DataAccessErrors() {
  }

  public static boolean isPoolExhausted(Throwable ex) {
    return ex instanceof CannotGetJdbcConnectionException
        || ex instanceof CannotCreateTransactionException
        || ex instanceof TransactionTimedOutException
        || ex instanceof QueryTimeoutException;
  }

  public static UnavailableException unavailable(Throwable cause) {
    return new UnavailableException("Database connection pool exhausted; retry later.",
        RETRY_AFTER_SECONDS, cause);
  }
}
