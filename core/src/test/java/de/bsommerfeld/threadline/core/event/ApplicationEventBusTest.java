package de.bsommerfeld.threadline.core.event;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.threadline.core.event.EngineEvents.EnrichmentPassEvent;
import de.bsommerfeld.threadline.core.event.EngineEvents.PostFactsMergedEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationEventBusTest {

    @Test
    void post_shouldDeliverEventToRegisteredListener() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<PostFactsMergedEvent>();

        Object listener = new Object() {
            @Subscribe
            public void onMerged(PostFactsMergedEvent event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post(new PostFactsMergedEvent(3, 1L));

        assertEquals(new PostFactsMergedEvent(3, 1L), received.get());
    }

    @Test
    void unregister_shouldStopDeliveringEvents() {
        var eventBus = new ApplicationEventBus();
        List<PostFactsMergedEvent> received = new ArrayList<>();

        Object listener = new Object() {
            @Subscribe
            public void onMerged(PostFactsMergedEvent event) {
                received.add(event);
            }
        };

        eventBus.register(listener);
        eventBus.post(new PostFactsMergedEvent(1, 1L));
        eventBus.unregister(listener);
        eventBus.post(new PostFactsMergedEvent(1, 2L));

        assertEquals(1, received.size());
    }

    @Test
    void post_shouldRouteByEventType() {
        var eventBus = new ApplicationEventBus();
        var merged = new AtomicReference<PostFactsMergedEvent>();
        var passes = new AtomicReference<EnrichmentPassEvent>();

        Object listener = new Object() {
            @Subscribe
            public void onMerged(PostFactsMergedEvent event) {
                merged.set(event);
            }

            @Subscribe
            public void onPass(EnrichmentPassEvent event) {
                passes.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post(new EnrichmentPassEvent(4, 3, 1));

        assertNull(merged.get());
        assertEquals(3, passes.get().resolved());
    }
}
