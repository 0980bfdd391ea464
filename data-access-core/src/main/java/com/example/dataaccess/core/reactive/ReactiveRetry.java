package com.example.dataaccess.core.reactive;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.dataaccess.core.retry.Retry;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;

/**
 * Reactive counterpart of {@link Retry}.
 *
 * <p>Each attempt subscribes to a freshly supplied {@link Mono}. Delays run on Reactor's timer, so
 * no thread is parked while waiting. Cancelling the returned {@code Mono} cancels any pending
 * delay and stops further attempts.
 *
 * <p>When retrying stops, the error of the last attempt is emitted as is, never a {@code
 * RetryExhaustedException}.
 *
 * <pre>{@code
 * Mono<String> body = ReactiveRetry.invoke(
 *     () -> Mono.fromFuture(() -> http.sendAsync(request, BodyHandlers.ofString()))
 *         .map(HttpResponse::body),
 *     Retry.Policy.of(3, Duration.ofMillis(250), IOException.class));
 * }</pre>
 */
public final class ReactiveRetry {

  private static final System.Logger LOGGER = System.getLogger(ReactiveRetry.class.getName());

  private ReactiveRetry() {}

  /**
   * Subscribes to the supplied publisher, resubscribing to a new one on recoverable errors.
   *
   * @param operation supplier of the publisher to run on each attempt
   * @param policy retry policy
   * @param <T> result type
   * @return a {@code Mono} emitting the value of the first successful attempt
   * @throws IllegalArgumentException if {@code operation} or {@code policy} is null
   */
  public static <T> Mono<T> invoke(
      final Supplier<? extends Mono<? extends T>> operation, final Retry.Policy policy) {
    if (operation == null) throw new IllegalArgumentException("operation must not be null");
    if (policy == null) throw new IllegalArgumentException("policy must not be null");

    final Mono<T> attempt = Mono.defer(operation);
    return attempt.retryWhen(retrySpec(policy));
  }

  static reactor.util.retry.Retry retrySpec(final Retry.Policy policy) {
    final long retries = policy.maxAttempts() - 1L;

    if (policy.delay().isZero()) {
      return reactor.util.retry.Retry.max(retries)
          .filter(policy::isRecoverable)
          .doBeforeRetry(ReactiveRetry::logRetry)
          .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    return reactor.util.retry.Retry.fixedDelay(retries, policy.delay())
        .filter(policy::isRecoverable)
        .doBeforeRetry(ReactiveRetry::logRetry)
        .onRetryExhaustedThrow((spec, signal) -> signal.failure());
  }

  private static void logRetry(final reactor.util.retry.Retry.RetrySignal signal) {
    LOGGER.log(DEBUG, "Attempt {0} failed, retrying...", signal.totalRetries() + 1);
  }
}
