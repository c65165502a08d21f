package offlinesync.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DaemonThreadFactoryTest {

    @Test
    void createsNumberedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("offlinesync-test-");

        Thread first = factory.newThread(() -> {});
        Thread second = factory.newThread(() -> {});

        assertEquals("offlinesync-test-1", first.getName());
        assertEquals("offlinesync-test-2", second.getName());
        assertTrue(first.isDaemon());
        assertNotNull(first.getUncaughtExceptionHandler());
    }

    @Test
    void rejectsNullPrefix() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
