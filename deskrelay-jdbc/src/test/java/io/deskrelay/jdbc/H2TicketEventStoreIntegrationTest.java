package io.deskrelay.jdbc;

import io.deskrelay.jdbc.store.AbstractJdbcTicketEventStore;
import io.deskrelay.jdbc.store.H2TicketEventStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;

import javax.sql.DataSource;

class H2TicketEventStoreIntegrationTest extends AbstractTicketEventStoreIntegrationTest {

    private final H2TicketEventStore store = new H2TicketEventStore();
    private JdbcDataSource dataSource;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = TestSchemas.freshH2();
    }

    @Override
    DataSource dataSource() {
        return dataSource;
    }

    @Override
    AbstractJdbcTicketEventStore store() {
        return store;
    }
}
