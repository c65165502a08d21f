/**
 * Service provider interfaces: persistence ({@link offlinesync.spi.MessageStore}),
 * JDBC connections, connectivity signal and metrics export.
 */
package offlinesync.spi;
