package infosquito.connect;

/**
 * Backoff policy that multiplies the delay after every failed attempt, up to a cap.
 *
 * <p>Delay formula: {@code min(maxDelay, initialDelay * multiplier^n)} for the
 * {@code n}-th retry (0-based). No jitter is applied, so the sequence is deterministic.
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {
  public static final long DEFAULT_INITIAL_DELAY_MS = 5_000L;
  public static final long DEFAULT_MAX_DELAY_MS = 320_000L;
  public static final int DEFAULT_MULTIPLIER = 2;

  private final long initialDelayMs;
  private final long maxDelayMs;
  private final int multiplier;

  /**
   * Creates a policy starting at 5 seconds, doubling up to 320 seconds.
   */
  public ExponentialBackoffPolicy() {
    this(DEFAULT_INITIAL_DELAY_MS, DEFAULT_MAX_DELAY_MS, DEFAULT_MULTIPLIER);
  }

  /**
   * @param initialDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs     maximum delay cap (milliseconds)
   * @param multiplier     growth factor applied after each attempt
   */
  public ExponentialBackoffPolicy(long initialDelayMs, long maxDelayMs, int multiplier) {
    if (initialDelayMs <= 0) {
      throw new IllegalArgumentException("initialDelayMs must be > 0, got: " + initialDelayMs);
    }
    if (maxDelayMs < initialDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= initialDelayMs, got: " + maxDelayMs);
    }
    if (multiplier < 1) {
      throw new IllegalArgumentException("multiplier must be >= 1, got: " + multiplier);
    }
    this.initialDelayMs = initialDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.multiplier = multiplier;
  }

  @Override
  public long initialDelayMs() {
    return initialDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  public int multiplier() {
    return multiplier;
  }

  @Override
  public long nextDelayMs(long currentDelayMs) {
    // Guard against overflow: anything past maxDelayMs / multiplier is capped directly
    if (currentDelayMs > maxDelayMs / multiplier) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, currentDelayMs * multiplier);
  }

  /**
   * Computes the delay for the {@code n}-th retry without walking the sequence.
   *
   * @param n 0-based retry number
   * @return {@code min(maxDelay, initialDelay * multiplier^n)}
   * @throws IllegalArgumentException if {@code n} is negative
   */
  public long computeDelayMs(int n) {
    if (n < 0) {
      throw new IllegalArgumentException("n must be >= 0, got: " + n);
    }
    long delay = initialDelayMs;
    for (int i = 0; i < n && delay < maxDelayMs; i++) {
      delay = nextDelayMs(delay);
    }
    return delay;
  }

  @Override
  public String toString() {
    return "ExponentialBackoffPolicy{initialDelayMs=" + initialDelayMs
        + ", maxDelayMs=" + maxDelayMs + ", multiplier=" + multiplier + '}';
  }
}
