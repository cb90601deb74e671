package guardrail.retry;

import java.util.Objects;

/**
 * Failure of an external service call, classified at its origin.
 *
 * <p>Adapters translating HTTP responses or socket errors should throw this type so the
 * retry layer can decide purely on {@link #kind()}.
 */
public class ServiceException extends RuntimeException {

  private final ErrorKind kind;
  private final int status;
  private final String code;

  public ServiceException(ErrorKind kind, String message) {
    this(kind, 0, null, message, null);
  }

  public ServiceException(ErrorKind kind, String message, Throwable cause) {
    this(kind, 0, null, message, cause);
  }

  protected ServiceException(ErrorKind kind, int status, String code, String message,
      Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.status = status;
    this.code = code;
  }

  /**
   * Classifies an HTTP status code.
   *
   * @param status  response status
   * @param message detail message
   * @return a new exception whose kind follows the status
   */
  public static ServiceException ofStatus(int status, String message) {
    return new ServiceException(kindOfStatus(status), status, null, message, null);
  }

  /**
   * Classifies a socket-level error code such as {@code ECONNRESET}. Unknown codes map to
   * {@link ErrorKind#UNKNOWN}.
   */
  public static ServiceException ofNetworkCode(String code, String message) {
    Objects.requireNonNull(code, "code");
    ErrorKind kind = switch (code) {
      case "ETIMEDOUT" -> ErrorKind.TIMEOUT;
      case "ECONNRESET", "ECONNREFUSED", "ENOTFOUND", "EAI_AGAIN", "ECONNABORTED" ->
          ErrorKind.NETWORK;
      default -> ErrorKind.UNKNOWN;
    };
    return new ServiceException(kind, 0, code, message, null);
  }

  public static ServiceException validation(String message) {
    return new ServiceException(ErrorKind.VALIDATION, message);
  }

  public static ServiceException authorization(String message) {
    return new ServiceException(ErrorKind.AUTHORIZATION, message);
  }

  public static ServiceException notFound(String message) {
    return new ServiceException(ErrorKind.NOT_FOUND, message);
  }

  public static ServiceException lockContention(String message, Throwable cause) {
    return new ServiceException(ErrorKind.LOCK_CONTENTION, message, cause);
  }

  static ErrorKind kindOfStatus(int status) {
    if (status >= 500) {
      return ErrorKind.SERVER;
    }
    return switch (status) {
      case 400, 422 -> ErrorKind.VALIDATION;
      case 401, 403 -> ErrorKind.AUTHORIZATION;
      case 404 -> ErrorKind.NOT_FOUND;
      case 408 -> ErrorKind.TIMEOUT;
      case 429 -> ErrorKind.RATE_LIMITED;
      default -> status >= 400 ? ErrorKind.CLIENT : ErrorKind.UNKNOWN;
    };
  }

  public ErrorKind kind() {
    return kind;
  }

  /**
   * @return the HTTP status, or 0 if the failure did not come from an HTTP response
   */
  public int status() {
    return status;
  }

  /**
   * @return the socket error code, or null
   */
  public String code() {
    return code;
  }

  /**
   * Message suitable for showing to an end user. Never contains the technical detail.
   */
  public String userMessage() {
    return userMessage(kind);
  }

  /**
   * End-user message for a failure of the given kind.
   */
  public static String userMessage(ErrorKind kind) {
    return switch (kind) {
      case VALIDATION -> "The submitted data is invalid. Please review it and try again.";
      case AUTHORIZATION -> "Your session is not authorized for this operation. Please sign in again.";
      case NOT_FOUND -> "The requested record was not found.";
      case CLIENT -> "The request could not be processed.";
      case NETWORK, TIMEOUT, SERVER, LOCK_CONTENTION ->
          "The service is temporarily unavailable. Please try again later.";
      case RATE_LIMITED, REJECTED -> "The system is busy. Please try again in a few moments.";
      case UNKNOWN -> "An unexpected error occurred.";
    };
  }
}
