/**
 * Read/write routing between the primary and weighted replicas.
 *
 * @see dbmanager.routing.ConnectionRouter
 * @see dbmanager.routing.StatementClassifier
 */
package dbmanager.routing;
