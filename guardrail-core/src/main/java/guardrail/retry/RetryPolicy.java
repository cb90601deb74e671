package guardrail.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable retry settings: attempt bound, backoff and retryability.
 *
 * <p>{@code maxAttempts} counts the first call, so a policy with {@code maxAttempts = 4}
 * retries at most three times.
 */
public final class RetryPolicy {

  /** 6 attempts, 100ms base, 5s cap, 50ms jitter. */
  public static final RetryPolicy CRITICAL = builder()
      .maxAttempts(6)
      .backoff(new ExponentialBackoff(100, 5_000, 50))
      .build();

  /** 4 attempts, 200ms base, 3s cap, 100ms jitter. */
  public static final RetryPolicy NORMAL = builder()
      .maxAttempts(4)
      .backoff(new ExponentialBackoff(200, 3_000, 100))
      .build();

  /** 3 attempts, 500ms base, 2s cap, 200ms jitter. */
  public static final RetryPolicy BACKGROUND = builder()
      .maxAttempts(3)
      .backoff(new ExponentialBackoff(500, 2_000, 200))
      .build();

  private final int maxAttempts;
  private final ExponentialBackoff backoff;
  private final RetryClassifier classifier;

  private RetryPolicy(Builder builder) {
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + builder.maxAttempts);
    }
    this.maxAttempts = builder.maxAttempts;
    this.backoff = Objects.requireNonNull(builder.backoff, "backoff");
    this.classifier = builder.classifier != null ? builder.classifier : RetryClassifiers.medical();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Copy of this policy with a different classifier.
   */
  public RetryPolicy withClassifier(RetryClassifier classifier) {
    return builder().maxAttempts(maxAttempts).backoff(backoff).classifier(classifier).build();
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public ExponentialBackoff backoff() {
    return backoff;
  }

  public RetryClassifier classifier() {
    return classifier;
  }

  public boolean isRetryable(Throwable error) {
    return classifier.isRetryable(error);
  }

  @Override
  public String toString() {
    return "RetryPolicy{maxAttempts=" + maxAttempts + ", " + backoff + "}";
  }

  /** Builder for {@link RetryPolicy}. */
  public static final class Builder {
    private int maxAttempts = 4;
    private ExponentialBackoff backoff = new ExponentialBackoff(200, 3_000, 100);
    private RetryClassifier classifier;

    private Builder() {}

    /**
     * Total attempts including the first call.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &ge; 1.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder backoff(ExponentialBackoff backoff) {
      this.backoff = backoff;
      return this;
    }

    public Builder backoff(Duration baseDelay, Duration maxDelay, Duration jitterMax) {
      this.backoff = new ExponentialBackoff(baseDelay, maxDelay, jitterMax);
      return this;
    }

    /**
     * Optional. Defaults to {@link RetryClassifiers#medical()}.
     */
    public Builder classifier(RetryClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    public RetryPolicy build() {
      return new RetryPolicy(this);
    }
  }
}
