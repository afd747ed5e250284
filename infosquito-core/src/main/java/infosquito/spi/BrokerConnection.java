package infosquito.spi;

import java.io.IOException;

/**
 * An open broker connection. Owned by exactly one subscription cycle.
 */
public interface BrokerConnection extends AutoCloseable {

    /**
     * Opens a channel used for consuming, acknowledging and publishing.
     *
     * @return a new channel
     * @throws IOException if the channel cannot be opened
     */
    BrokerChannel openChannel() throws IOException;

    @Override
    void close() throws IOException;
}
