package infosquito.util;

import java.time.Duration;
import java.util.logging.Logger;

/**
 * Blocking pause used between connection attempts, reconnect cycles and requeues.
 *
 * <p>The default implementation treats an interrupt as the end of the pause: it logs a
 * warning and returns normally. The interrupt is consumed; owners that need to stop
 * their loop check their own running flag after the pause.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Returns the default {@link Thread#sleep}-based implementation.
     *
     * @return the default sleeper
     */
    static Sleeper threadSleep() {
        return ThreadSleeper.INSTANCE;
    }

    /**
     * Pauses the calling thread.
     *
     * @param duration how long to pause; zero or negative returns immediately
     */
    void sleep(Duration duration);

    /**
     * {@link Thread#sleep}-based sleeper.
     */
    final class ThreadSleeper implements Sleeper {
        private static final Logger logger = Logger.getLogger(ThreadSleeper.class.getName());
        static final ThreadSleeper INSTANCE = new ThreadSleeper();

        private ThreadSleeper() {
        }

        @Override
        public void sleep(Duration duration) {
            long millis = duration.toMillis();
            if (millis <= 0) {
                return;
            }
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                logger.warning("sleep interrupted");
            }
        }
    }
}
