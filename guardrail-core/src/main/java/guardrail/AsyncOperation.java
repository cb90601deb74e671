package guardrail;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * A call to an external service: takes no arguments and eventually yields a result or fails.
 *
 * <p>Implementations should return quickly and complete the stage from their own I/O threads.
 * Throwing from {@link #invoke()} is treated the same as returning a failed stage.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface AsyncOperation<T> {

  CompletionStage<T> invoke() throws Exception;

  /**
   * Adapts a blocking call by running it on the common pool.
   *
   * @param call the blocking call
   * @param <T>  the result type
   * @return an operation that runs {@code call} asynchronously on every invocation
   */
  static <T> AsyncOperation<T> ofBlocking(Callable<T> call) {
    return () -> CompletableFuture.supplyAsync(() -> {
      try {
        return call.call();
      } catch (RuntimeException e) {
        throw e;
      } catch (Exception e) {
        throw new CompletionException(e);
      }
    });
  }
}
