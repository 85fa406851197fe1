/**
 * Service Provider Interfaces (SPI) for plugging deskrelay into an application.
 *
 * <p>Persistence ({@link io.deskrelay.spi.TicketEventStore}, {@link io.deskrelay.spi.TicketStore},
 * {@link io.deskrelay.spi.CommentStore}), transactions ({@link io.deskrelay.spi.TxContext},
 * {@link io.deskrelay.spi.TransactionRunner}), realtime connections
 * ({@link io.deskrelay.spi.SessionTransport}, {@link io.deskrelay.spi.CredentialVerifier})
 * and boundary collaborators ({@link io.deskrelay.spi.Authorizer}, {@link io.deskrelay.spi.Notifier},
 * {@link io.deskrelay.spi.MetricsExporter}).
 */
package io.deskrelay.spi;
