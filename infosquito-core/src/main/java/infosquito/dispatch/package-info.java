/**
 * Sequential message dispatch: routing-key lookup, handler invocation and
 * acknowledgment/requeue of each delivery.
 *
 * @see infosquito.dispatch.MessageDispatcher
 * @see infosquito.dispatch.RequeuePolicy
 */
package infosquito.dispatch;
