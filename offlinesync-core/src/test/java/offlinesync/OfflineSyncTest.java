package offlinesync;

import offlinesync.connectivity.ManualConnectivityProbe;
import offlinesync.event.QueueEventType;
import offlinesync.status.SyncStatus;
import offlinesync.sync.SyncResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static offlinesync.TestConnections.stubCp;
import static org.junit.jupiter.api.Assertions.*;

class OfflineSyncTest {

    private static OfflineSync.Builder builder(InMemoryMessageStore store, ManualConnectivityProbe probe,
                                               MessageDelivery delivery) {
        return OfflineSync.builder()
                .connectionProvider(stubCp())
                .messageStore(store)
                .delivery(delivery)
                .connectivityProbe(probe)
                .drainTimeoutMs(1000);
    }

    @Test
    void messagesQueuedOfflineAreDeliveredWhenConnectivityReturns() throws Exception {
        InMemoryMessageStore store = new InMemoryMessageStore();
        ManualConnectivityProbe probe = new ManualConnectivityProbe(false);
        List<String> sent = new CopyOnWriteArrayList<>();
        try (OfflineSync sync = builder(store, probe, (chatId, payload) -> {
            sent.add(payload);
            return DeliveryResult.delivered();
        }).build()) {
            CountDownLatch completed = new CountDownLatch(1);
            sync.subscribe(QueueEventType.SYNC_COMPLETED, event -> completed.countDown());

            sync.enqueue("A", "first");
            sync.enqueue("A", "second");
            assertTrue(sent.isEmpty(), "enqueue never delivers");
            assertEquals(new SyncStatus(false, false, 2, 0, null), sync.status());

            probe.setOnline(true);

            assertTrue(completed.await(5, TimeUnit.SECONDS));
            assertEquals(List.of("first", "second"), sent);
            assertEquals(0, store.size());
            assertTrue(sync.isOnline());
            assertEquals(0, sync.status().queuedCount());
            assertNotNull(sync.status().lastSyncAt());
        }
    }

    @Test
    void leftoverMessagesAreDeliveredOnStartWhenOnline() throws Exception {
        InMemoryMessageStore store = new InMemoryMessageStore();
        ManualConnectivityProbe offline = new ManualConnectivityProbe(false);
        try (OfflineSync first = builder(store, offline, (c, p) -> DeliveryResult.delivered()).build()) {
            first.enqueue("A", "from-last-session");
        }

        List<String> sent = new CopyOnWriteArrayList<>();
        CountDownLatch delivered = new CountDownLatch(1);
        try (OfflineSync second = builder(store, new ManualConnectivityProbe(true), (c, p) -> {
            sent.add(p);
            delivered.countDown();
            return DeliveryResult.delivered();
        }).build()) {
            assertTrue(delivered.await(5, TimeUnit.SECONDS));
            assertEquals(List.of("from-last-session"), sent);
        }
        assertEquals(2, store.openCount.get());
    }

    @Test
    void syncOnStartCanBeDisabled() throws Exception {
        InMemoryMessageStore store = new InMemoryMessageStore();
        AtomicBoolean called = new AtomicBoolean();
        try (OfflineSync sync = builder(store, new ManualConnectivityProbe(true), (c, p) -> {
            called.set(true);
            return DeliveryResult.delivered();
        }).syncOnStart(false).build()) {
            sync.enqueue("A", "1");
            assertFalse(called.get());

            SyncResult result = sync.syncQueue().get(5, TimeUnit.SECONDS);
            assertEquals(SyncResult.completed(1, 0), result);
        }
    }

    @Test
    void failedMessagesCanBeRequeuedAndDelivered() throws Exception {
        InMemoryMessageStore store = new InMemoryMessageStore();
        AtomicBoolean backendUp = new AtomicBoolean(false);
        try (OfflineSync sync = builder(store, new ManualConnectivityProbe(true), (c, p) -> {
            if (!backendUp.get()) {
                throw new IllegalStateException("503");
            }
            return DeliveryResult.delivered();
        }).syncOnStart(false).maxRetries(1).build()) {
            long id = sync.enqueue("A", "1");
            sync.syncQueue().get(5, TimeUnit.SECONDS);
            assertEquals(1, sync.failedMessages().count(null));
            assertEquals(1, sync.status().failedCount());

            backendUp.set(true);
            assertTrue(sync.failedMessages().retry(id));
            assertEquals(SyncResult.completed(1, 0), sync.syncQueue().get(5, TimeUnit.SECONDS));
            assertEquals(0, store.size());
        }
    }

    @Test
    void clearOperationsDelegateToQueue() {
        InMemoryMessageStore store = new InMemoryMessageStore();
        try (OfflineSync sync = builder(store, new ManualConnectivityProbe(false),
                (c, p) -> DeliveryResult.delivered()).build()) {
            sync.enqueue("A", "1");
            sync.enqueue("B", "1");

            assertEquals(1, sync.clearChatQueue("A"));
            assertEquals(1, sync.queuedMessages(null).size());
            assertEquals(1, sync.clearAllQueues());
        }
    }

    @Test
    void periodicResyncRetriesWhileOnline() throws Exception {
        InMemoryMessageStore store = new InMemoryMessageStore();
        CountDownLatch attempts = new CountDownLatch(2);
        try (OfflineSync sync = builder(store, new ManualConnectivityProbe(true), (c, p) -> {
            attempts.countDown();
            throw new IllegalStateException("503");
        }).syncOnStart(false).resyncInterval(Duration.ofMillis(20)).build()) {
            sync.enqueue("A", "1");
            assertTrue(attempts.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void storeThatCannotOpenFailsBuild() {
        InMemoryMessageStore store = new InMemoryMessageStore();
        store.failOn("open");

        assertThrows(StorageException.class, () ->
                builder(store, new ManualConnectivityProbe(true), (c, p) -> DeliveryResult.delivered()).build());
    }

    @Test
    void builderRequiresCollaboratorsAndSingleUse() {
        assertThrows(NullPointerException.class, () -> OfflineSync.builder()
                .connectionProvider(stubCp())
                .messageStore(new InMemoryMessageStore())
                .connectivityProbe(new ManualConnectivityProbe(true))
                .build());

        OfflineSync.Builder builder = builder(new InMemoryMessageStore(), new ManualConnectivityProbe(false),
                (c, p) -> DeliveryResult.delivered());
        builder.build().close();
        assertThrows(IllegalStateException.class, builder::build);
    }
}
