/**
 * Spring transaction integration.
 *
 * <p>{@link io.deskrelay.spring.SpringTxContext} lets
 * {@link io.deskrelay.TicketEventWriter} join Spring-managed transactions, and
 * {@link io.deskrelay.spring.SpringTransactionRunner} runs the services' units of work
 * through a {@link org.springframework.transaction.PlatformTransactionManager}.
 */
package io.deskrelay.spring;
