package guardrail.retry;

import guardrail.bulkhead.BulkheadRejectedException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Closed classification of failures, assigned where the failure originates.
 *
 * <p>Retry decisions are a switch over this enum, never a match on message text.
 */
public enum ErrorKind {
  /** Input was rejected, e.g. a malformed national id. */
  VALIDATION,
  /** Caller is not authenticated or not allowed; includes expired sessions. */
  AUTHORIZATION,
  /** The requested record does not exist. */
  NOT_FOUND,
  /** Any other 4xx response. */
  CLIENT,
  /** Connection could not be established or was dropped. */
  NETWORK,
  /** The remote side did not answer in time. */
  TIMEOUT,
  /** The remote side asked us to slow down. */
  RATE_LIMITED,
  /** Optimistic lock or deadlock in a backing store. */
  LOCK_CONTENTION,
  /** 5xx response. */
  SERVER,
  /** Local bulkhead refused to run the operation. */
  REJECTED,
  UNKNOWN;

  /**
   * Classifies {@code error}, looking through {@link CompletionException} and
   * {@link ExecutionException} wrappers.
   *
   * @param error the failure, may be null
   * @return the kind, {@link #UNKNOWN} if the type is not recognised
   */
  public static ErrorKind of(Throwable error) {
    Throwable t = unwrap(error);
    if (t instanceof ServiceException se) {
      return se.kind();
    }
    if (t instanceof RetriesExhaustedException && t.getCause() != null) {
      return of(t.getCause());
    }
    if (t instanceof BulkheadRejectedException) {
      return REJECTED;
    }
    if (t instanceof SocketTimeoutException || t instanceof TimeoutException) {
      return TIMEOUT;
    }
    if (t instanceof ConnectException || t instanceof UnknownHostException
        || t instanceof IOException) {
      return NETWORK;
    }
    if (t instanceof IllegalArgumentException) {
      return VALIDATION;
    }
    if (t instanceof SecurityException) {
      return AUTHORIZATION;
    }
    return UNKNOWN;
  }

  /**
   * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
   */
  public static Throwable unwrap(Throwable error) {
    Throwable t = error;
    while ((t instanceof CompletionException || t instanceof ExecutionException)
        && t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }
}
