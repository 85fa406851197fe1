package io.deskrelay.jdbc;

import io.deskrelay.jdbc.store.AbstractJdbcTicketEventStore;
import io.deskrelay.jdbc.store.H2TicketEventStore;
import io.deskrelay.jdbc.store.JdbcTicketEventStores;
import io.deskrelay.jdbc.store.PostgresTicketEventStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcTicketEventStoresTest {

    @Test
    void registersBundledStores() {
        assertEquals(2, JdbcTicketEventStores.all().size());
        assertInstanceOf(H2TicketEventStore.class, JdbcTicketEventStores.get("h2"));
        assertInstanceOf(PostgresTicketEventStore.class, JdbcTicketEventStores.get("PostgreSQL"));
    }

    @Test
    void unknownNameIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> JdbcTicketEventStores.get("oracle"));
        assertTrue(e.getMessage().contains("Available"));
    }

    @Test
    void detectsByUrlPrefix() {
        assertInstanceOf(PostgresTicketEventStore.class,
                JdbcTicketEventStores.detect("jdbc:postgresql://localhost:5432/desk"));
        assertInstanceOf(H2TicketEventStore.class, JdbcTicketEventStores.detect("JDBC:H2:mem:test"));
    }

    @Test
    void unsupportedUrlIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> JdbcTicketEventStores.detect("jdbc:sqlite:desk.db"));
        assertThrows(IllegalArgumentException.class, () -> JdbcTicketEventStores.detect(""));
    }

    @Test
    void detectsFromDataSource() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:detect_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");

        assertInstanceOf(H2TicketEventStore.class, JdbcTicketEventStores.detect(dataSource));
    }

    @Test
    void withTableNameKeepsDialect() {
        AbstractJdbcTicketEventStore custom = JdbcTicketEventStores.get("postgresql").withTableName("desk_events");

        assertInstanceOf(PostgresTicketEventStore.class, custom);
        assertThrows(IllegalArgumentException.class,
                () -> JdbcTicketEventStores.get("h2").withTableName("desk-events"));
    }
}
