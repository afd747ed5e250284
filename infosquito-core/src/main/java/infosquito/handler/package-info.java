/**
 * Built-in handlers: reindex triggers and ping/pong health checks.
 */
package infosquito.handler;
