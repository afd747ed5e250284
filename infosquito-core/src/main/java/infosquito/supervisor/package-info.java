/**
 * The reconnect-forever control loop.
 *
 * @see infosquito.supervisor.SubscriptionSupervisor
 */
package infosquito.supervisor;
