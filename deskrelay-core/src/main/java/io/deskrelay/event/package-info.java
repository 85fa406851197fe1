/**
 * Ticket event log model: {@link io.deskrelay.event.NewTicketEvent} before append,
 * {@link io.deskrelay.event.TicketEvent} after.
 */
package io.deskrelay.event;
