package guardrail.retry;

/**
 * Every permitted attempt failed with a retryable error. The cause is the last failure,
 * unchanged.
 */
public final class RetriesExhaustedException extends RuntimeException {

  private final String operationName;
  private final int attempts;
  private final int maxAttempts;

  public RetriesExhaustedException(String operationName, int attempts, int maxAttempts,
      Throwable lastError) {
    super("Operation '" + operationName + "' failed after " + attempts + "/" + maxAttempts
        + " attempts: " + (lastError != null ? lastError.getMessage() : null), lastError);
    this.operationName = operationName;
    this.attempts = attempts;
    this.maxAttempts = maxAttempts;
  }

  public String operationName() {
    return operationName;
  }

  public int attempts() {
    return attempts;
  }

  public int maxAttempts() {
    return maxAttempts;
  }
}
