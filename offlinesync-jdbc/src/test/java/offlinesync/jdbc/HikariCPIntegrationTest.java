package offlinesync.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import offlinesync.DeliveryResult;
import offlinesync.OfflineSync;
import offlinesync.connectivity.ManualConnectivityProbe;
import offlinesync.jdbc.store.H2MessageStore;
import offlinesync.sync.SyncResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;

  @BeforeEach
  void setup() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("offlinesync-test-pool");
    hikariDs = new HikariDataSource(config);
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void concurrentEnqueuesThroughPoolAreAllDelivered() throws Exception {
    Set<String> delivered = ConcurrentHashMap.newKeySet();
    ManualConnectivityProbe probe = new ManualConnectivityProbe(false);
    try (OfflineSync sync = OfflineSync.builder()
        .connectionProvider(new DataSourceConnectionProvider(hikariDs))
        .messageStore(new H2MessageStore())
        .connectivityProbe(probe)
        .delivery((chatId, payload) -> {
          delivered.add(payload);
          return DeliveryResult.delivered();
        })
        .syncOnStart(false)
        .build()) {

      ExecutorService writers = Executors.newFixedThreadPool(4);
      List<Future<Long>> ids = new ArrayList<>();
      for (int i = 0; i < 40; i++) {
        String payload = "{\"n\":" + i + "}";
        String chatId = "chat-" + (i % 4);
        ids.add(writers.submit(() -> sync.enqueue(chatId, payload)));
      }
      Set<Long> unique = ConcurrentHashMap.newKeySet();
      for (Future<Long> id : ids) {
        unique.add(id.get(5, TimeUnit.SECONDS));
      }
      writers.shutdown();

      assertEquals(40, unique.size());
      assertEquals(40, sync.queue().count());

      probe.setOnline(true);
      SyncResult result = waitForDrain(sync);

      assertTrue(result.success());
      assertEquals(40, delivered.size());
      assertEquals(0, sync.queue().count());
    }
  }

  private static SyncResult waitForDrain(OfflineSync sync) throws Exception {
    long deadline = System.currentTimeMillis() + 10_000;
    SyncResult result = sync.syncQueue().get(5, TimeUnit.SECONDS);
    while (result.isSkipped() && System.currentTimeMillis() < deadline) {
      Thread.sleep(20);
      result = sync.syncQueue().get(5, TimeUnit.SECONDS);
    }
    return result;
  }
}
