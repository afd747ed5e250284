package infosquito.spring.boot;

import infosquito.Infosquito;
import org.springframework.context.SmartLifecycle;

import java.util.logging.Logger;

/**
 * Starts the subscription loop on context refresh and closes it on shutdown.
 *
 * <p>{@link #isRunning()} reflects the loop itself, so a loop thread that died is
 * reported as stopped.
 */
public class InfosquitoLifecycle implements SmartLifecycle {
    private static final Logger logger = Logger.getLogger(InfosquitoLifecycle.class.getName());

    private final Infosquito infosquito;
    private final boolean autoStartup;
    private boolean started;

    public InfosquitoLifecycle(Infosquito infosquito, boolean autoStartup) {
        this.infosquito = infosquito;
        this.autoStartup = autoStartup;
    }

    @Override
    public synchronized void start() {
        if (started) {
            return;
        }
        infosquito.start();
        started = true;
        logger.info("Started AMQP subscription on queue " + infosquito.topology().queueName());
    }

    @Override
    public synchronized void stop() {
        if (started) {
            infosquito.close();
        }
    }

    @Override
    public boolean isRunning() {
        return infosquito.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
