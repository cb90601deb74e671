package guardrail.retry;

/**
 * Built-in {@link RetryClassifier} instances.
 */
public final class RetryClassifiers {

  private static final RetryClassifier STANDARD = error -> isTransient(ErrorKind.of(error));

  private static final RetryClassifier MEDICAL = error -> {
    ErrorKind kind = ErrorKind.of(error);
    return switch (kind) {
      case VALIDATION, AUTHORIZATION, NOT_FOUND -> false;
      default -> isTransient(kind);
    };
  };

  private static final RetryClassifier NEVER = error -> false;

  private RetryClassifiers() {}

  /**
   * Retries network failures, timeouts, rate limiting, lock contention and server errors.
   */
  public static RetryClassifier standard() {
    return STANDARD;
  }

  /**
   * Same as {@link #standard()}, with validation, authorization and not-found failures
   * explicitly excluded. The default for every {@link RetryPolicy}.
   */
  public static RetryClassifier medical() {
    return MEDICAL;
  }

  public static RetryClassifier never() {
    return NEVER;
  }

  static boolean isTransient(ErrorKind kind) {
    return switch (kind) {
      case NETWORK, TIMEOUT, RATE_LIMITED, LOCK_CONTENTION, SERVER -> true;
      case VALIDATION, AUTHORIZATION, NOT_FOUND, CLIENT, REJECTED, UNKNOWN -> false;
    };
  }
}
