/**
 * JDBC support: {@link offlinesync.jdbc.DataSourceConnectionProvider} and the
 * {@link offlinesync.jdbc.JdbcTemplate} helper used by the message stores.
 */
package offlinesync.jdbc;
