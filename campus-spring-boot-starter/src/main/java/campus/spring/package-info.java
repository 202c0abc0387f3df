/**
 * Spring transaction bridge for repositories and the outbox publisher.
 *
 * @see campus.spring.SpringTxContext
 * @see campus.spring.SpringTransactions
 */
package campus.spring;
