package io.deskrelay.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC event log stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.deskrelay.jdbc.store.AbstractJdbcTicketEventStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AbstractJdbcTicketEventStore store = JdbcTicketEventStores.detect(dataSource);
 * AbstractJdbcTicketEventStore custom = JdbcTicketEventStores.get("postgresql").withTableName("desk_events");
 * }</pre>
 */
public final class JdbcTicketEventStores {

    private static final List<AbstractJdbcTicketEventStore> STORES;
    private static final Map<String, AbstractJdbcTicketEventStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcTicketEventStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcTicketEventStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcTicketEventStores() {
    }

    /**
     * Returns all registered stores.
     */
    public static List<AbstractJdbcTicketEventStore> all() {
        return STORES;
    }

    /**
     * Gets a store by name.
     *
     * @param name store name (case-insensitive)
     * @throws IllegalArgumentException if no store has that name
     */
    public static AbstractJdbcTicketEventStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcTicketEventStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown event store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the store from a DataSource's JDBC URL.
     *
     * @throws IllegalStateException if the URL cannot be read or no store matches
     */
    public static AbstractJdbcTicketEventStore detect(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        String url;
        try (Connection conn = dataSource.getConnection()) {
            url = conn.getMetaData().getURL();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect event store from DataSource", e);
        }
        try {
            return detect(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    /**
     * Auto-detects the store from a JDBC URL.
     *
     * @throws IllegalArgumentException if no store matches
     */
    public static AbstractJdbcTicketEventStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        String normalized = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcTicketEventStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (normalized.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return store;
                }
            }
        }
        throw new IllegalArgumentException("No event store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
