/**
 * Spring Boot auto-configuration for the offline message queue.
 *
 * <p>Add the starter, a {@link javax.sql.DataSource} and a {@link offlinesync.MessageDelivery}
 * bean; {@link offlinesync.spring.boot.OfflineSyncAutoConfiguration} wires the rest from
 * {@code offlinesync.*} properties.
 */
package offlinesync.spring.boot;
