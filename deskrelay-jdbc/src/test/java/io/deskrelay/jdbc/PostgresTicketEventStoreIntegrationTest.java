package io.deskrelay.jdbc;

import io.deskrelay.jdbc.store.AbstractJdbcTicketEventStore;
import io.deskrelay.jdbc.store.PostgresTicketEventStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;

@DockerAvailable
@Testcontainers
class PostgresTicketEventStoreIntegrationTest extends AbstractTicketEventStoreIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("deskrelay_test");

    private static final PostgresTicketEventStore STORE = new PostgresTicketEventStore();
    private static SimpleDataSource dataSource;

    @BeforeAll
    static void initSchema() throws Exception {
        dataSource = new SimpleDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        TestSchemas.apply(dataSource, "/schema/postgresql.sql");
    }

    @BeforeEach
    void truncate() throws Exception {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("TRUNCATE TABLE ticket_events RESTART IDENTITY");
        }
    }

    @Override
    DataSource dataSource() {
        return dataSource;
    }

    @Override
    AbstractJdbcTicketEventStore store() {
        return STORE;
    }
}
