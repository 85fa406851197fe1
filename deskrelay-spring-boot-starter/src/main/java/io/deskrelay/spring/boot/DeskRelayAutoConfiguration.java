package io.deskrelay.spring.boot;

import io.deskrelay.TicketEventWriter;
import io.deskrelay.catchup.CatchUpReader;
import io.deskrelay.hub.HubWriterHook;
import io.deskrelay.hub.SessionGateway;
import io.deskrelay.hub.SessionSettings;
import io.deskrelay.hub.SubscriptionHub;
import io.deskrelay.hub.SubscriptionPolicy;
import io.deskrelay.jdbc.DataSourceConnectionProvider;
import io.deskrelay.jdbc.TableNames;
import io.deskrelay.jdbc.store.AbstractJdbcTicketEventStore;
import io.deskrelay.jdbc.store.JdbcCommentStore;
import io.deskrelay.jdbc.store.JdbcTicketEventStores;
import io.deskrelay.jdbc.store.JdbcTicketStore;
import io.deskrelay.service.CommentService;
import io.deskrelay.service.TicketService;
import io.deskrelay.spi.Authorizer;
import io.deskrelay.spi.CommentStore;
import io.deskrelay.spi.ConnectionProvider;
import io.deskrelay.spi.CredentialVerifier;
import io.deskrelay.spi.MetricsExporter;
import io.deskrelay.spi.Notifier;
import io.deskrelay.spi.TicketEventStore;
import io.deskrelay.spi.TicketStore;
import io.deskrelay.spi.TransactionRunner;
import io.deskrelay.spi.TxContext;
import io.deskrelay.spring.SpringTransactionRunner;
import io.deskrelay.spring.SpringTxContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/**
 * Auto-configuration for deskrelay.
 *
 * <p>Wires the event log, stores, transaction runner, subscription hub and catch-up
 * reader from a {@link DataSource} and {@link DeskRelayProperties}. The
 * {@link SessionGateway} is created when the application provides a
 * {@link CredentialVerifier}; the ticket and comment services when it provides an
 * {@link Authorizer}.
 *
 * @see DeskRelayProperties
 * @see DeskRelayMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@ConditionalOnClass(SubscriptionHub.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(DeskRelayProperties.class)
public class DeskRelayAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(TicketEventStore.class)
    public AbstractJdbcTicketEventStore ticketEventStore(DataSource dataSource, DeskRelayProperties props) {
        AbstractJdbcTicketEventStore detected = JdbcTicketEventStores.detect(dataSource);
        String tableName = props.getTableName();
        if (!TableNames.DEFAULT_EVENT_TABLE.equals(tableName)) {
            return detected.withTableName(tableName);
        }
        return detected;
    }

    @Bean
    @ConditionalOnMissingBean(TicketStore.class)
    public JdbcTicketStore ticketStore() {
        return new JdbcTicketStore();
    }

    @Bean
    @ConditionalOnMissingBean(CommentStore.class)
    public JdbcCommentStore commentStore() {
        return new JdbcCommentStore();
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(TxContext.class)
    public SpringTxContext txContext(DataSource dataSource) {
        return new SpringTxContext(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(TransactionRunner.class)
    public SpringTransactionRunner transactionRunner(DataSource dataSource,
                                                     ObjectProvider<PlatformTransactionManager> transactionManager) {
        return new SpringTransactionRunner(dataSource,
                transactionManager.getIfAvailable(() -> new DataSourceTransactionManager(dataSource)));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SubscriptionHub subscriptionHub(DeskRelayProperties props,
                                           ObjectProvider<MetricsExporter> metricsProvider) {
        SubscriptionHub.Builder builder = SubscriptionHub.builder()
                .dispatchQueueCapacity(props.getHub().getDispatchQueueCapacity())
                .drainTimeoutMs(props.getHub().getDrainTimeoutMs());
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public TicketEventWriter ticketEventWriter(TxContext txContext,
                                               TicketEventStore ticketEventStore,
                                               SubscriptionHub subscriptionHub,
                                               ObjectProvider<MetricsExporter> metricsProvider) {
        return new TicketEventWriter(txContext, ticketEventStore,
                new HubWriterHook(subscriptionHub), metricsProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public CatchUpReader catchUpReader(ConnectionProvider connectionProvider,
                                       TicketEventStore ticketEventStore,
                                       DeskRelayProperties props) {
        return new CatchUpReader(connectionProvider, ticketEventStore,
                props.getCatchUp().getDefaultLimit(), props.getCatchUp().getMaxLimit());
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionSettings sessionSettings(DeskRelayProperties props) {
        DeskRelayProperties.Session session = props.getSession();
        return SessionSettings.builder()
                .readTimeout(session.getReadTimeout())
                .writeTimeout(session.getWriteTimeout())
                .keepaliveInterval(session.getKeepaliveInterval())
                .maxFrameBytes(session.getMaxFrameBytes())
                .outboundQueueCapacity(session.getOutboundQueueCapacity())
                .build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean(CredentialVerifier.class)
    public SessionGateway sessionGateway(SubscriptionHub subscriptionHub,
                                         CredentialVerifier credentialVerifier,
                                         SessionSettings sessionSettings,
                                         ObjectProvider<SubscriptionPolicy> subscriptionPolicy,
                                         DeskRelayProperties props) {
        return SessionGateway.builder()
                .hub(subscriptionHub)
                .credentialVerifier(credentialVerifier)
                .settings(sessionSettings)
                .subscriptionPolicy(subscriptionPolicy.getIfAvailable())
                .shutdownTimeoutMs(props.getSession().getShutdownTimeoutMs())
                .build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean(Authorizer.class)
    public TicketService ticketService(TransactionRunner transactionRunner,
                                       TicketStore ticketStore,
                                       TicketEventWriter ticketEventWriter,
                                       CatchUpReader catchUpReader,
                                       Authorizer authorizer,
                                       ObjectProvider<Notifier> notifier) {
        return TicketService.builder()
                .transactionRunner(transactionRunner)
                .ticketStore(ticketStore)
                .eventWriter(ticketEventWriter)
                .catchUpReader(catchUpReader)
                .authorizer(authorizer)
                .notifier(notifier.getIfAvailable())
                .build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean(Authorizer.class)
    public CommentService commentService(TicketService ticketService,
                                         TransactionRunner transactionRunner,
                                         CommentStore commentStore,
                                         TicketEventWriter ticketEventWriter,
                                         Authorizer authorizer,
                                         ObjectProvider<Notifier> notifier) {
        return CommentService.builder()
                .ticketService(ticketService)
                .transactionRunner(transactionRunner)
                .commentStore(commentStore)
                .eventWriter(ticketEventWriter)
                .authorizer(authorizer)
                .notifier(notifier.getIfAvailable())
                .build();
    }
}
