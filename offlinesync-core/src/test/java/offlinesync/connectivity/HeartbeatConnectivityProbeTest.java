package offlinesync.connectivity;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatConnectivityProbeTest {

    @Test
    void startPerformsFirstCheckSynchronously() {
        try (HeartbeatConnectivityProbe probe = HeartbeatConnectivityProbe.builder()
                .check(() -> true)
                .interval(Duration.ofHours(1))
                .build()) {
            assertFalse(probe.current());
            probe.start();
            assertTrue(probe.current());
        }
    }

    @Test
    void reportsEveryCheckToSubscribers() {
        AtomicBoolean reachable = new AtomicBoolean(true);
        List<Boolean> reports = new CopyOnWriteArrayList<>();
        try (HeartbeatConnectivityProbe probe = HeartbeatConnectivityProbe.builder()
                .check(reachable::get)
                .interval(Duration.ofHours(1))
                .build()) {
            probe.onChange(reports::add);

            probe.checkNow();
            reachable.set(false);
            probe.checkNow();

            assertEquals(List.of(true, false), reports);
            assertFalse(probe.current());
        }
    }

    @Test
    void ioFailureCountsAsOffline() {
        try (HeartbeatConnectivityProbe probe = HeartbeatConnectivityProbe.builder()
                .check(() -> {
                    throw new IOException("connection refused");
                })
                .initiallyOnline(true)
                .interval(Duration.ofHours(1))
                .build()) {
            probe.checkNow();
            assertFalse(probe.current());
        }
    }

    @Test
    void tcpCheckDetectsListeningPort() throws Exception {
        try (ServerSocket server = new ServerSocket(0);
             HeartbeatConnectivityProbe probe = HeartbeatConnectivityProbe.builder()
                     .host("127.0.0.1")
                     .port(server.getLocalPort())
                     .connectTimeout(Duration.ofSeconds(2))
                     .interval(Duration.ofHours(1))
                     .build()) {
            probe.checkNow();
            assertTrue(probe.current());
        }
    }

    @Test
    void builderValidatesSettings() {
        assertThrows(NullPointerException.class, () -> HeartbeatConnectivityProbe.builder().build());
        assertThrows(IllegalArgumentException.class, () ->
                HeartbeatConnectivityProbe.builder().host("localhost").port(0).build());
        assertThrows(IllegalArgumentException.class, () ->
                HeartbeatConnectivityProbe.builder().check(() -> true).interval(Duration.ZERO).build());
    }

    @Test
    void closedProbeCannotStart() {
        HeartbeatConnectivityProbe probe = HeartbeatConnectivityProbe.builder()
                .check(() -> true)
                .build();
        probe.close();
        probe.close();
        assertThrows(IllegalStateException.class, probe::start);
    }
}
