package guardrail.audit;

/**
 * A batch could not be stored. The trail keeps the batch and retries it on the next flush.
 */
public class AuditSinkException extends Exception {

  public AuditSinkException(String message) {
    super(message);
  }

  public AuditSinkException(String message, Throwable cause) {
    super(message, cause);
  }
}
