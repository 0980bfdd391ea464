package com.example.dataaccess.core.retry;

import static java.lang.System.Logger.Level.WARNING;

import java.time.Duration;
import java.util.Optional;

/**
 * Default retry settings, read from system properties or environment variables:
 *
 * <ul>
 *   <li>dataaccess.retry.max-attempts / DATAACCESS_RETRY_MAX_ATTEMPTS (default 3)
 *   <li>dataaccess.retry.delay-millis / DATAACCESS_RETRY_DELAY_MILLIS (default 100)
 * </ul>
 *
 * <p>Invalid values are logged and replaced by the default.
 */
public final class RetryDefaults {

  private static final System.Logger LOGGER = System.getLogger(RetryDefaults.class.getName());

  static final int DEFAULT_MAX_ATTEMPTS = 3;
  static final long DEFAULT_DELAY_MILLIS = 100L;

  private RetryDefaults() {}

  /**
   * Builds a policy from the configured defaults with the given recoverable kinds.
   *
   * @param recoverableKinds exception kinds eligible for retry, none for all
   * @return configured policy
   */
  @SafeVarargs
  public static Retry.Policy policy(final Class<? extends Exception>... recoverableKinds) {
    return new Retry.Policy(
        maxAttempts(), Duration.ofMillis(delayMillis()), Retry.Policy.kinds(recoverableKinds));
  }

  static int maxAttempts() {
    return read("dataaccess.retry.max-attempts", "DATAACCESS_RETRY_MAX_ATTEMPTS")
        .filter(value -> value >= 1 && value <= Integer.MAX_VALUE)
        .map(Long::intValue)
        .orElse(DEFAULT_MAX_ATTEMPTS);
  }

  static long delayMillis() {
    return read("dataaccess.retry.delay-millis", "DATAACCESS_RETRY_DELAY_MILLIS")
        .filter(value -> value >= 0)
        .orElse(DEFAULT_DELAY_MILLIS);
  }

  private static Optional<Long> read(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .map(String::trim)
        .filter(value -> !value.isEmpty())
        .flatMap(
            value -> {
              try {
                return Optional.of(Long.parseLong(value));
              } catch (final NumberFormatException e) {
                LOGGER.log(WARNING, "Ignoring non-numeric value for {0}: {1}", property, value);
                return Optional.empty();
              }
            });
  }
}
