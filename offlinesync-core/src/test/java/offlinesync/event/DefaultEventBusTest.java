package offlinesync.event;

import offlinesync.RecordingListener;
import offlinesync.Subscription;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class DefaultEventBusTest {

    @Test
    void deliversEventsToAllListenersInSubscriptionOrder() {
        DefaultEventBus bus = new DefaultEventBus();
        List<String> calls = new CopyOnWriteArrayList<>();
        bus.subscribe(event -> calls.add("first"));
        bus.subscribe(event -> calls.add("second"));

        bus.publish(new QueueEvent.SyncStarted());

        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    void typedSubscriptionOnlyReceivesMatchingEvents() {
        DefaultEventBus bus = new DefaultEventBus();
        RecordingListener listener = new RecordingListener();
        bus.subscribe(QueueEventType.MESSAGE_QUEUED, listener);

        bus.publish(new QueueEvent.SyncStarted());
        bus.publish(new QueueEvent.MessageQueued("chat-1", 7));
        bus.publish(new QueueEvent.MessageRemoved(7));

        assertEquals(List.of(QueueEventType.MESSAGE_QUEUED), listener.types());
        assertEquals(new QueueEvent.MessageQueued("chat-1", 7), listener.events().get(0));
    }

    @Test
    void unsubscribeStopsDeliveryAndIsIdempotent() {
        DefaultEventBus bus = new DefaultEventBus();
        RecordingListener listener = new RecordingListener();
        Subscription subscription = bus.subscribe(listener);

        bus.publish(new QueueEvent.Online());
        subscription.unsubscribe();
        subscription.unsubscribe();
        bus.publish(new QueueEvent.Offline());

        assertEquals(List.of(QueueEventType.ONLINE), listener.types());
        assertEquals(0, bus.listenerCount());
    }

    @Test
    void sameListenerRegisteredTwiceIsRemovedOneRegistrationAtATime() {
        DefaultEventBus bus = new DefaultEventBus();
        RecordingListener listener = new RecordingListener();
        Subscription first = bus.subscribe(listener);
        bus.subscribe(listener);

        first.close();
        bus.publish(new QueueEvent.SyncStarted());

        assertEquals(1, listener.events().size());
    }

    @Test
    void failingListenerDoesNotBlockOthers() {
        DefaultEventBus bus = new DefaultEventBus();
        RecordingListener listener = new RecordingListener();
        bus.subscribe(event -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(listener);

        assertDoesNotThrow(() -> bus.publish(new QueueEvent.SyncCompleted(1, 0)));
        assertEquals(1, listener.events().size());
    }

    @Test
    void listenerMayUnsubscribeWhilePublishing() {
        DefaultEventBus bus = new DefaultEventBus();
        RecordingListener later = new RecordingListener();
        Subscription[] self = new Subscription[1];
        self[0] = bus.subscribe(event -> self[0].unsubscribe());
        bus.subscribe(later);

        bus.publish(new QueueEvent.Online());
        bus.publish(new QueueEvent.Offline());

        assertEquals(2, later.events().size());
        assertEquals(1, bus.listenerCount());
    }

    @Test
    void rejectsNullArguments() {
        DefaultEventBus bus = new DefaultEventBus();
        assertThrows(NullPointerException.class, () -> bus.subscribe(null));
        assertThrows(NullPointerException.class, () -> bus.subscribe(null, event -> {}));
        assertThrows(NullPointerException.class, () -> bus.publish(null));
    }

    @Test
    void eventTypesExposeWireNames() {
        assertEquals("messageQueued", new QueueEvent.MessageQueued("c", 1).type().eventName());
        assertEquals("allQueuesCleared", new QueueEvent.AllQueuesCleared(0).type().eventName());
        assertEquals("syncError", new QueueEvent.SyncError("x").type().eventName());
    }
}
