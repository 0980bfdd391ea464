package com.example.dataaccess.core.retry;

import static java.lang.System.Logger.Level.DEBUG;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Bounded retry helper.
 *
 * <p>Runs an operation on the calling thread and re-runs it when it fails, up to a total number
 * of attempts, pausing for a fixed delay between attempts. When a list of recoverable exception
 * kinds is given, any other failure ends the loop immediately.
 *
 * <p>The exception that ends the loop is always the exact object thrown by the last attempt; it is
 * never wrapped. The only exception this class raises on its own is {@link
 * RetryCancelledException}, when the calling thread is interrupted while waiting between
 * attempts.
 *
 * <h2>Retry on Any Failure</h2>
 *
 * <pre>{@code
 * String body = Retry.invoke(() -> http.fetch(uri), 3, Duration.ofMillis(200));
 * }</pre>
 *
 * <h2>Retry on Transient SQL Failures Only</h2>
 *
 * <pre>{@code
 * int count = Retry.invoke(
 *     () -> countUsers(connection),
 *     5,
 *     Duration.ofMillis(100),
 *     SQLTransientException.class,
 *     SQLRecoverableException.class);
 * }</pre>
 */
public final class Retry {

  private static final System.Logger LOGGER = System.getLogger(Retry.class.getName());

  private Retry() {}

  /**
   * Unit of work that returns a value or throws.
   *
   * @param <T> result type
   * @param <E> checked exception type
   */
  @FunctionalInterface
  public interface Operation<T, E extends Exception> {
    T get() throws E;
  }

  /**
   * Unit of work without a result.
   *
   * @param <E> checked exception type
   */
  @FunctionalInterface
  public interface Action<E extends Exception> {
    void run() throws E;
  }

  /** Suspends the calling thread between attempts. */
  @FunctionalInterface
  interface Sleeper {
    void sleep(final Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
      return duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
    }
  }

  /**
   * Retry policy.
   *
   * @param maxAttempts total attempts including the first, must be >= 1
   * @param delay pause between a failed attempt and the next one, non-negative and at most
   *     {@link #MAX_DELAY}
   * @param recoverableKinds exception kinds eligible for retry; empty or null means every failure
   *     is eligible
   */
  public record Policy(
      int maxAttempts, Duration delay, List<Class<? extends Exception>> recoverableKinds) {

    /** Longest delay {@link Thread#sleep(long, int)} can express. */
    public static final Duration MAX_DELAY = Duration.ofMillis(Long.MAX_VALUE);

    public Policy {
      if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
      if (delay == null || delay.isNegative())
        throw new IllegalArgumentException("delay must be non-negative");
      if (delay.compareTo(MAX_DELAY) > 0)
        throw new IllegalArgumentException("delay must not exceed " + MAX_DELAY);
      recoverableKinds = recoverableKinds == null ? List.of() : List.copyOf(recoverableKinds);
    }

    /**
     * Creates a fixed delay policy.
     *
     * @param attempts number of attempts (including first)
     * @param delay delay between attempts
     * @param recoverableKinds exception kinds eligible for retry, none for all
     * @return fixed delay policy
     */
    @SafeVarargs
    public static Policy of(
        final int attempts,
        final Duration delay,
        final Class<? extends Exception>... recoverableKinds) {
      return new Policy(attempts, delay, kinds(recoverableKinds));
    }

    /** A null array means no kinds, so every failure is recoverable. */
    @SafeVarargs
    static List<Class<? extends Exception>> kinds(
        final Class<? extends Exception>... recoverableKinds) {
      return recoverableKinds == null ? List.of() : Arrays.asList(recoverableKinds);
    }

    /**
     * Policy that runs the operation once and never retries.
     *
     * @return single attempt policy
     */
    public static Policy once() {
      return new Policy(1, Duration.ZERO, List.of());
    }

    /**
     * Whether {@code failure} belongs to one of the recoverable kinds. Subclasses of a listed kind
     * match.
     *
     * @param failure the failure to classify
     * @return true when the failure may be retried
     */
    public boolean isRecoverable(final Throwable failure) {
      if (recoverableKinds.isEmpty()) return true;
      for (final var kind : recoverableKinds) if (kind.isInstance(failure)) return true;
      return false;
    }
  }

  /**
   * Runs {@code operation}, retrying on failure.
   *
   * <p>A {@code maxAttempts} of zero or less still runs the operation once.
   *
   * @param operation operation to execute
   * @param maxAttempts total attempts including the first
   * @param delay pause between attempts, {@link Duration#ZERO} for none
   * @param recoverableKinds exception kinds eligible for retry, none for all
   * @param <T> result type
   * @param <E> checked exception type
   * @return the value of the first successful attempt
   * @throws E the failure of the last attempt
   * @throws IllegalArgumentException if {@code operation} is null or {@code delay} is invalid
   * @throws RetryCancelledException if interrupted while waiting between attempts
   */
  @SafeVarargs
  public static <T, E extends Exception> T invoke(
      final Operation<T, E> operation,
      final int maxAttempts,
      final Duration delay,
      final Class<? extends Exception>... recoverableKinds)
      throws E {
    if (operation == null) throw new IllegalArgumentException("operation must not be null");
    final var policy = Policy.of(Math.max(1, maxAttempts), delay, recoverableKinds);
    return invoke(operation, policy, Sleeper.threadSleep());
  }

  /**
   * Runs {@code operation} under the given policy.
   *
   * @param operation operation to execute
   * @param policy retry policy
   * @param <T> result type
   * @param <E> checked exception type
   * @return the value of the first successful attempt
   * @throws E the failure of the last attempt
   * @throws RetryCancelledException if interrupted while waiting between attempts
   */
  public static <T, E extends Exception> T invoke(
      final Operation<T, E> operation, final Policy policy) throws E {
    return invoke(operation, policy, Sleeper.threadSleep());
  }

  /**
   * Runs {@code action}, retrying on failure.
   *
   * @param action action to execute
   * @param maxAttempts total attempts including the first
   * @param delay pause between attempts
   * @param recoverableKinds exception kinds eligible for retry, none for all
   * @param <E> checked exception type
   * @throws E the failure of the last attempt
   */
  @SafeVarargs
  public static <E extends Exception> void run(
      final Action<E> action,
      final int maxAttempts,
      final Duration delay,
      final Class<? extends Exception>... recoverableKinds)
      throws E {
    if (action == null) throw new IllegalArgumentException("action must not be null");
    invoke(asOperation(action), maxAttempts, delay, recoverableKinds);
  }

  /**
   * Runs {@code action} under the given policy.
   *
   * @param action action to execute
   * @param policy retry policy
   * @param <E> checked exception type
   * @throws E the failure of the last attempt
   */
  public static <E extends Exception> void run(final Action<E> action, final Policy policy)
      throws E {
    if (action == null) throw new IllegalArgumentException("action must not be null");
    invoke(asOperation(action), policy);
  }

  static <T, E extends Exception> T invoke(
      final Operation<T, E> operation, final Policy policy, final Sleeper sleeper) throws E {
    if (operation == null) throw new IllegalArgumentException("operation must not be null");
    if (policy == null) throw new IllegalArgumentException("policy must not be null");

    var remaining = policy.maxAttempts();
    var attempt = 0;

    while (true) {
      attempt++;
      try {
        return operation.get();
      } catch (final Exception failure) {
        @SuppressWarnings("unchecked")
        final E typedFailure = (E) failure;

        // cancelled from inside the attempt, never retried
        if (failure instanceof RetryCancelledException) throw typedFailure;

        if (--remaining <= 0) {
          LOGGER.log(DEBUG, "Attempt {0} failed, no attempts left", attempt);
          throw typedFailure;
        }

        if (!policy.isRecoverable(failure)) {
          LOGGER.log(
              DEBUG,
              "Attempt {0} failed with non-recoverable {1}",
              attempt,
              failure.getClass().getName());
          throw typedFailure;
        }

        LOGGER.log(DEBUG, "Attempt {0} failed, retrying...", attempt);

        if (!policy.delay().isZero()) pause(sleeper, policy.delay(), failure);
      }
    }
  }

  private static void pause(final Sleeper sleeper, final Duration delay, final Exception last) {
    try {
      sleeper.sleep(delay);
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      final var cancelled = new RetryCancelledException("Interrupted during retry delay", ie);
      cancelled.addSuppressed(last);
      throw cancelled;
    }
  }

  private static <E extends Exception> Operation<Void, E> asOperation(final Action<E> action) {
    return () -> {
      action.run();
      return null;
    };
  }
}
