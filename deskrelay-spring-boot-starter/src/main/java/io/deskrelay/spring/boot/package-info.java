/**
 * Spring Boot auto-configuration for deskrelay.
 *
 * <p>{@link io.deskrelay.spring.boot.DeskRelayAutoConfiguration} wires the event log,
 * subscription hub and catch-up reader from {@code deskrelay.*} properties. Provide a
 * {@link io.deskrelay.spi.CredentialVerifier} bean to get a
 * {@link io.deskrelay.hub.SessionGateway}, and an {@link io.deskrelay.spi.Authorizer}
 * bean to get the ticket and comment services.
 *
 * @see io.deskrelay.spring.boot.DeskRelayProperties
 */
package io.deskrelay.spring.boot;
