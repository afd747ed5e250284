package infosquito.demo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot Starter demo: a reindexing notifier with no wiring code.
 *
 * <p>The starter connects to the broker from {@code application.properties}, declares
 * the {@code de} exchange and the {@code infosquito.reindex} queue, and runs
 * {@link LoggingReindexAction} for every {@code index.all} / {@code index.data}
 * message.
 *
 * <p>Run with: mvn install -DskipTests && mvn -f samples/infosquito-spring-boot-demo/pom.xml spring-boot:run
 *
 * <p>Try it from the RabbitMQ management UI by publishing to exchange {@code de}:
 * routing key {@code index.all} triggers a reindex, {@code events.infosquito.ping}
 * is answered on {@code events.infosquito.pong}.
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
