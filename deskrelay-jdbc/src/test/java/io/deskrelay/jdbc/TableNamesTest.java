package io.deskrelay.jdbc;

import io.deskrelay.jdbc.store.H2TicketEventStore;
import io.deskrelay.jdbc.store.JdbcTicketStore;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

    @Test
    void acceptsIdentifiers() {
        assertEquals("ticket_events", TableNames.validate("ticket_events"));
        assertEquals("_Events2", TableNames.validate("_Events2"));
    }

    @Test
    void rejectsNonIdentifiers() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("events; DROP TABLE tickets"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("2events"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("public.events"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
        assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    }

    @Test
    void storesValidateConfiguredTableNames() {
        assertThrows(IllegalArgumentException.class, () -> new H2TicketEventStore("bad-name"));
        assertThrows(IllegalArgumentException.class, () -> new JdbcTicketStore("tickets x"));
    }
}
