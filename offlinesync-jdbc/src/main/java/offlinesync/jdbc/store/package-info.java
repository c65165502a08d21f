/**
 * JDBC {@link offlinesync.spi.MessageStore} implementations for SQLite, H2, PostgreSQL
 * and MySQL, with versioned schema migration and auto-detection by JDBC URL.
 */
package offlinesync.jdbc.store;
