package io.deskrelay.spring.boot;

import io.deskrelay.TicketEventWriter;
import io.deskrelay.catchup.CatchUpReader;
import io.deskrelay.catchup.EventPage;
import io.deskrelay.event.EventType;
import io.deskrelay.hub.ClientSession;
import io.deskrelay.hub.SessionGateway;
import io.deskrelay.hub.SessionSettings;
import io.deskrelay.hub.SubscriptionHub;
import io.deskrelay.jdbc.DataSourceConnectionProvider;
import io.deskrelay.jdbc.store.AbstractJdbcTicketEventStore;
import io.deskrelay.jdbc.store.H2TicketEventStore;
import io.deskrelay.jdbc.store.JdbcTicketEventStores;
import io.deskrelay.service.CommentService;
import io.deskrelay.service.TicketService;
import io.deskrelay.spi.Authorizer;
import io.deskrelay.spi.ConnectionProvider;
import io.deskrelay.spi.CredentialVerifier;
import io.deskrelay.spi.InboundFrame;
import io.deskrelay.spi.SessionTransport;
import io.deskrelay.spi.TransactionRunner;
import io.deskrelay.spi.TxContext;
import io.deskrelay.spring.SpringTransactionRunner;
import io.deskrelay.spring.SpringTxContext;
import io.deskrelay.ticket.NewTicket;
import io.deskrelay.ticket.Ticket;
import io.deskrelay.ticket.TicketPriority;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DeskRelayAutoConfigurationTest {

  private static final UUID USER = UUID.fromString("0f8fad5b-d9cb-469f-a165-70867728950e");

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          DataSourceTransactionManagerAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          DeskRelayAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:deskrelay_auto_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:schema/h2.sql");

  @Test
  void createsCoreBeans() {
    runner.run(ctx -> {
      assertInstanceOf(H2TicketEventStore.class, ctx.getBean(AbstractJdbcTicketEventStore.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(SpringTxContext.class, ctx.getBean(TxContext.class));
      assertInstanceOf(SpringTransactionRunner.class, ctx.getBean(TransactionRunner.class));
      assertNotNull(ctx.getBean(SubscriptionHub.class));
      assertNotNull(ctx.getBean(TicketEventWriter.class));
      assertNotNull(ctx.getBean(CatchUpReader.class));
      assertEquals(SessionSettings.defaults().readTimeout(), ctx.getBean(SessionSettings.class).readTimeout());
    });
  }

  @Test
  void gatewayAndServicesNeedApplicationBeans() {
    runner.run(ctx -> {
      assertFalse(ctx.containsBean("sessionGateway"));
      assertFalse(ctx.containsBean("ticketService"));
      assertFalse(ctx.containsBean("commentService"));
    });
  }

  @Test
  void createsGatewayWhenCredentialVerifierPresent() {
    runner.withUserConfiguration(SecurityConfig.class).run(ctx -> {
      SessionGateway gateway = ctx.getBean(SessionGateway.class);
      assertEquals(USER, gateway.authenticate("valid-token"));
    });
  }

  @Test
  void closingContextEndsLiveSessionsPromptly() {
    runner.withUserConfiguration(SecurityConfig.class).run(ctx -> {
      IdleTransport transport = new IdleTransport();
      ClientSession session = ctx.getBean(SessionGateway.class).open(USER, transport);
      assertTrue(ctx.getBean(SubscriptionHub.class).isUserConnected(USER));

      long start = System.nanoTime();
      ctx.close();
      Duration took = Duration.ofNanos(System.nanoTime() - start);

      assertTrue(took.compareTo(Duration.ofSeconds(3)) < 0, "context close took " + took);
      assertTrue(session.awaitTermination(Duration.ofSeconds(1)));
      assertFalse(session.isOpen());
      assertTrue(transport.closed.await(1, TimeUnit.SECONDS));
    });
  }

  @Test
  void bindsSessionProperties() {
    runner
        .withPropertyValues(
            "deskrelay.session.read-timeout=30s",
            "deskrelay.session.keepalive-interval=20s",
            "deskrelay.session.max-frame-bytes=2048",
            "deskrelay.session.outbound-queue-capacity=64")
        .run(ctx -> {
          SessionSettings settings = ctx.getBean(SessionSettings.class);
          assertEquals(Duration.ofSeconds(30), settings.readTimeout());
          assertEquals(Duration.ofSeconds(20), settings.keepaliveInterval());
          assertEquals(2048, settings.maxFrameBytes());
          assertEquals(64, settings.outboundQueueCapacity());
        });
  }

  @Test
  void rejectsKeepaliveNotShorterThanReadTimeout() {
    runner
        .withPropertyValues(
            "deskrelay.session.read-timeout=10s",
            "deskrelay.session.keepalive-interval=10s")
        .run(ctx -> assertNotNull(ctx.getStartupFailure()));
  }

  @Test
  void customTableName() {
    runner
        .withPropertyValues("deskrelay.table-name=desk_events")
        .run(ctx -> {
          AbstractJdbcTicketEventStore store = ctx.getBean(AbstractJdbcTicketEventStore.class);
          assertInstanceOf(H2TicketEventStore.class, store);
          assertNotSame(JdbcTicketEventStores.get("h2"), store);
        });
  }

  @Test
  void servicesAppendEventsThroughSpringTransactions() {
    runner.withUserConfiguration(SecurityConfig.class).run(ctx -> {
      TicketService tickets = ctx.getBean(TicketService.class);
      CommentService comments = ctx.getBean(CommentService.class);

      Ticket ticket = tickets.create(USER, NewTicket.of("Printer down", "Floor 3", TicketPriority.HIGH, USER));
      comments.addComment(USER, ticket.id(), "Still down");

      EventPage page = ctx.getBean(CatchUpReader.class).read(ticket.id());
      assertEquals(2, page.events().size());
      assertEquals(EventType.TICKET_CREATED, page.events().get(0).type());
      assertEquals(EventType.COMMENT_ADDED, page.events().get(1).type());
    });
  }

  /** A peer that never sends anything until the connection is closed. */
  static final class IdleTransport implements SessionTransport {
    final CountDownLatch closed = new CountDownLatch(1);

    @Override
    public InboundFrame read(Duration timeout) throws IOException {
      try {
        if (closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
          throw new EOFException("transport closed");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new InterruptedIOException("interrupted");
      }
      throw new SocketTimeoutException("read timed out");
    }

    @Override
    public void write(String text, Duration timeout) {
    }

    @Override
    public void sendKeepalive(Duration timeout) {
    }

    @Override
    public void close() {
      closed.countDown();
    }
  }

  @Configuration
  static class SecurityConfig {
    @Bean
    CredentialVerifier credentialVerifier() {
      return credential -> "valid-token".equals(credential) ? Optional.of(USER) : Optional.empty();
    }

    @Bean
    Authorizer authorizer() {
      return Authorizer.ALLOW_ALL;
    }
  }
}
