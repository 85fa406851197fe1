/**
 * Authorized ticket and comment operations built on the aggregate, the stores and the
 * {@link io.deskrelay.TicketEventWriter}.
 */
package io.deskrelay.service;
