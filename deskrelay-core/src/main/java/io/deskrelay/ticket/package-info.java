/**
 * Ticket aggregate, comments, and the immutable snapshots carried in event payloads.
 *
 * <p>Every mutation that reaches the database goes through {@link io.deskrelay.ticket.Ticket}:
 * creation validates input, {@code updateStatus} enforces the lifecycle and
 * {@code assign} rejects closed tickets. Failures are unchecked exceptions that
 * the service layer lets propagate to the caller untouched.
 */
package io.deskrelay.ticket;
