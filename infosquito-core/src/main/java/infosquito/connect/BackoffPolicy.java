package infosquito.connect;

import java.util.stream.LongStream;

/**
 * Strategy for computing the delays between connection attempts.
 *
 * <p>A policy is stateless: every call to {@link #delays()} starts a fresh sequence
 * at {@link #initialDelayMs()}.
 *
 * @see ExponentialBackoffPolicy
 */
public interface BackoffPolicy {

    /**
     * Returns the delay before the second attempt.
     *
     * @return the first delay in milliseconds
     */
    long initialDelayMs();

    /**
     * Computes the delay that follows {@code currentDelayMs}.
     *
     * @param currentDelayMs the delay just used
     * @return the next delay in milliseconds (non-negative)
     */
    long nextDelayMs(long currentDelayMs);

    /**
     * Returns the infinite delay sequence starting at {@link #initialDelayMs()}.
     *
     * @return a lazy, unbounded stream of delays in milliseconds
     */
    default LongStream delays() {
        return LongStream.iterate(initialDelayMs(), this::nextDelayMs);
    }
}
