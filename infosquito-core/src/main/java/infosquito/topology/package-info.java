/**
 * Broker topology: a topic exchange, the reindex queue and its bindings.
 */
package infosquito.topology;
