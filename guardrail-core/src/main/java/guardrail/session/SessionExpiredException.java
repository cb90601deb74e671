package guardrail.session;

import guardrail.retry.ErrorKind;
import guardrail.retry.ServiceException;

/**
 * The session is expired or unknown. Classified as {@link ErrorKind#AUTHORIZATION}, so it is
 * never retried.
 */
public final class SessionExpiredException extends ServiceException {

  private final String sessionId;

  public SessionExpiredException(String sessionId, String message) {
    super(ErrorKind.AUTHORIZATION, message);
    this.sessionId = sessionId;
  }

  public String sessionId() {
    return sessionId;
  }
}
