package infosquito.amqp;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import infosquito.spi.BrokerChannel;
import infosquito.spi.BrokerConnection;

import java.io.IOException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BrokerConnection} wrapping a RabbitMQ {@link Connection}.
 */
public final class AmqpBrokerConnection implements BrokerConnection {
  private static final Logger logger = Logger.getLogger(AmqpBrokerConnection.class.getName());

  private final Connection connection;

  public AmqpBrokerConnection(Connection connection) {
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  @Override
  public BrokerChannel openChannel() throws IOException {
    Channel channel;
    try {
      channel = connection.createChannel();
    } catch (AlreadyClosedException e) {
      throw new IOException("AMQP connection already closed", e);
    }
    if (channel == null) {
      throw new IOException("No channel available on AMQP connection");
    }
    return new AmqpBrokerChannel(channel);
  }

  @Override
  public void close() throws IOException {
    if (!connection.isOpen()) {
      return;
    }
    try {
      connection.close();
    } catch (AlreadyClosedException e) {
      logger.log(Level.FINE, "AMQP connection closed concurrently", e);
    }
  }

  public boolean isOpen() {
    return connection.isOpen();
  }
}
