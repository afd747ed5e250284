/**
 * Broker connection establishment with capped exponential backoff.
 *
 * @see infosquito.connect.ConnectionManager
 * @see infosquito.connect.BackoffPolicy
 */
package infosquito.connect;
