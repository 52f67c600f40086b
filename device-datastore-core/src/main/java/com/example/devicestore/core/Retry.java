package com.example.devicestore.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.sql.SQLException;

/**
 * Bounded retry helper used while bootstrapping the device store.
 *
 * <p>The policy is an explicit value so the same backoff can be reused by any bootstrap-style
 * operation and exercised in isolation with a fake {@link Sleeper}.
 *
 * <pre>{@code
 * Retry.withPolicy(
 *     () -> probe(dataSource),
 *     Retry.Policy.linear(20, 1_000L),
 *     (attempt, e) -> logger.log(WARNING, "could not connect: " + e.getMessage()),
 *     Retry.Sleeper.system());
 * }</pre>
 */
public final class Retry {

  private static final System.Logger LOGGER = System.getLogger(Retry.class.getName());

  private Retry() {}

  /**
   * Supplier that can throw {@link SQLException}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface SqlExceptionSupplier<T> {
    T get() throws SQLException;
  }

  /** Pause between attempts. Replaced by a recording fake in tests. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(final long millis) throws InterruptedException;

    static Sleeper system() {
      return Thread::sleep;
    }
  }

  /** Receives every failed attempt, including the last one. */
  @FunctionalInterface
  public interface FailureListener {
    void onFailure(final int attempt, final SQLException error);

    static FailureListener none() {
      return (attempt, error) -> {};
    }
  }

  /** Growth of the delay between consecutive attempts. */
  public enum Backoff {
    FIXED,
    LINEAR,
    EXPONENTIAL
  }

  /**
   * Retry policy configuration.
   *
   * @param maxAttempts maximum number of attempts (including first), must be >= 1
   * @param initialDelayMillis delay before the second attempt in milliseconds, must be >= 0
   * @param maxDelayMillis cap for growing delays, must be >= initialDelayMillis
   * @param backoff how the delay grows with each attempt
   */
  public record Policy(
      int maxAttempts, long initialDelayMillis, long maxDelayMillis, Backoff backoff) {

    public Policy {
      if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
      if (initialDelayMillis < 0)
        throw new IllegalArgumentException("initialDelayMillis must be >= 0");
      if (maxDelayMillis < initialDelayMillis)
        throw new IllegalArgumentException("maxDelayMillis must be >= initialDelayMillis");
      if (backoff == null) throw new IllegalArgumentException("backoff cannot be null");
    }

    /**
     * Creates a fixed delay retry policy.
     *
     * @param attempts number of attempts (including first)
     * @param delayMillis delay between attempts in milliseconds
     * @return fixed delay retry policy
     */
    public static Policy fixed(final int attempts, final long delayMillis) {
      return new Policy(attempts, delayMillis, delayMillis, Backoff.FIXED);
    }

    /**
     * Creates a linear backoff policy: the n-th retry waits {@code n * unitMillis}.
     *
     * @param attempts number of attempts (including first)
     * @param unitMillis delay unit in milliseconds
     * @return linear backoff retry policy
     */
    public static Policy linear(final int attempts, final long unitMillis) {
      return new Policy(attempts, unitMillis, Long.MAX_VALUE, Backoff.LINEAR);
    }

    /**
     * Creates an exponential backoff policy that doubles the delay up to one minute.
     *
     * @param attempts number of attempts (including first)
     * @param initialDelay initial delay in milliseconds
     * @return exponential backoff retry policy
     */
    public static Policy exponential(final int attempts, final long initialDelay) {
      return new Policy(
          attempts, initialDelay, Math.max(initialDelay, 60_000L), Backoff.EXPONENTIAL);
    }

    /**
     * Calculates the delay before a given attempt.
     *
     * @param attempt attempt about to be made (1-based)
     * @return delay in milliseconds, 0 for the first attempt
     */
    public long calculateDelay(final int attempt) {
      if (attempt <= 1) return 0L;

      final var retry = attempt - 1;
      final long delay =
          switch (backoff) {
            case LINEAR ->
                retry > maxDelayMillis / Math.max(1L, initialDelayMillis)
                    ? maxDelayMillis
                    : initialDelayMillis * retry;
            case EXPONENTIAL ->
                (long) Math.min(initialDelayMillis * Math.pow(2.0, retry - 1), maxDelayMillis);
            case FIXED -> initialDelayMillis;
          };
      return Math.min(delay, maxDelayMillis);
    }
  }

  /**
   * Runs {@code op} until it succeeds or the policy's attempts are used up.
   *
   * <p>Every failure is handed to {@code listener}. No delay follows the final attempt. If the
   * thread is interrupted while waiting, the interrupt flag is restored and the last failure is
   * rethrown.
   *
   * @param op operation to execute
   * @param policy retry policy
   * @param listener failure callback
   * @param sleeper pause between attempts
   * @param <T> result type
   * @return the operation result
   * @throws SQLException the last failure once all attempts fail
   */
  public static <T> T withPolicy(
      final SqlExceptionSupplier<? extends T> op,
      final Policy policy,
      final FailureListener listener,
      final Sleeper sleeper)
      throws SQLException {
    var attempt = 0;
    while (true) {
      attempt++;
      try {
        return op.get();
      } catch (final SQLException e) {
        listener.onFailure(attempt, e);

        if (attempt >= policy.maxAttempts()) {
          LOGGER.log(WARNING, "All {0} attempts failed", attempt);
          throw e;
        }

        final var delay = policy.calculateDelay(attempt + 1);
        LOGGER.log(DEBUG, "Attempt {0} failed, retrying in {1} ms", attempt, delay);
        if (delay > 0) {
          try {
            sleeper.sleep(delay);
          } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw e;
          }
        }
      }
    }
  }
}
