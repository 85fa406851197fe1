package io.deskrelay.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for work outside a caller transaction, such as
 * catch-up reads.
 *
 * <p>Callers are responsible for closing the returned connection.
 */
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
