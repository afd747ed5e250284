/**
 * Spring Boot auto-configuration for the reindexing notifier.
 *
 * <p>Define a {@link infosquito.ReindexAction} bean and the starter connects to the
 * broker configured under {@code infosquito.amqp.*} when the context starts.
 */
package infosquito.spring.boot;
