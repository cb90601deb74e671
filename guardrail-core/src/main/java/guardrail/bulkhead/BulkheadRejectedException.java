package guardrail.bulkhead;

import java.util.Objects;

/**
 * Base type for failures raised by a {@link Bulkhead} before the wrapped operation ran.
 *
 * <p>A rejection never means the external service failed; it means local capacity was
 * exhausted or deliberately drained.
 */
public abstract class BulkheadRejectedException extends RuntimeException {

  private final String serviceName;

  protected BulkheadRejectedException(String serviceName, String message) {
    super(message);
    this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
  }

  public String serviceName() {
    return serviceName;
  }
}
