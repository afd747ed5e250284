package infosquito.spi;

import java.io.IOException;

/**
 * Opens connections to the message broker.
 *
 * @see infosquito.connect.ConnectionManager
 */
public interface BrokerConnector {

    /**
     * Makes a single attempt to connect to the broker.
     *
     * @param uri the broker URI
     * @return an open connection
     * @throws IOException on a transport-level failure; callers may retry
     */
    BrokerConnection connect(String uri) throws IOException;
}
