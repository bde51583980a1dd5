package com.fw24.framework.event;

import com.fw24.framework.model.event.CrudOperation;
import com.fw24.framework.model.event.EntityEventType;
import com.fw24.framework.model.event.EventMatcher;
import com.fw24.framework.model.event.EventPayload;
import com.fw24.framework.model.event.EventPhase;
import com.fw24.framework.model.event.EventSubPhase;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultEventDispatcherTest {

    private final DefaultEventDispatcher dispatcher = new DefaultEventDispatcher();

    private static EventPayload<Object> event(EventPhase phase, EventSubPhase subPhase) {
        EntityEventType type = EntityEventType.builder()
                .entity("user")
                .operation(CrudOperation.GET)
                .phase(phase)
                .subPhase(subPhase)
                .build();
        return EventPayload.builder().type(type.toMatcher()).entityName("user").build();
    }

    @Test
    public void testWildcardReceivesEveryEvent() {
        List<EventPayload<?>> received = new CopyOnWriteArrayList<>();
        dispatcher.on(EventMatcher.wildcard(), received::add);

        dispatcher.dispatch(event(EventPhase.PRE, null));
        dispatcher.dispatch(EventPayload.builder().type(EventMatcher.of("custom")).build());

        assertEquals(2, received.size());
    }

    @Test
    public void testStructuredSubsetMatching() {
        AtomicInteger prePhase = new AtomicInteger();
        AtomicInteger preValidate = new AtomicInteger();
        AtomicInteger postPhase = new AtomicInteger();
        AtomicInteger structuredWildcard = new AtomicInteger();
        dispatcher.on(EventMatcher.structured(Map.of("phase", EventPhase.PRE)), e -> prePhase.incrementAndGet());
        dispatcher.on(EventMatcher.structured(Map.of("phase", "pre", "subPhase", "validate")), e -> preValidate.incrementAndGet());
        dispatcher.on(EventMatcher.structured(Map.of("phase", "post")), e -> postPhase.incrementAndGet());
        dispatcher.on(EventMatcher.structured(Map.of()), e -> structuredWildcard.incrementAndGet());

        dispatcher.dispatch(event(EventPhase.PRE, null));
        dispatcher.dispatch(event(EventPhase.PRE, EventSubPhase.VALIDATE));

        assertEquals(2, prePhase.get());
        assertEquals(1, preValidate.get());
        assertEquals(0, postPhase.get());
        assertEquals(2, structuredWildcard.get());
    }

    @Test
    public void testNamedEventsDoNotReachStructuredListeners() {
        AtomicInteger structured = new AtomicInteger();
        AtomicInteger named = new AtomicInteger();
        dispatcher.on(EventMatcher.structured(Map.of()), e -> structured.incrementAndGet());
        dispatcher.on(EventMatcher.of("user.created"), e -> named.incrementAndGet());

        dispatcher.dispatch(EventPayload.builder().type(EventMatcher.of("user.created")).build());

        assertEquals(0, structured.get());
        assertEquals(1, named.get());
    }

    @Test
    public void testListenerRegisteredUnderSeveralKeysRunsOnce() {
        AtomicInteger calls = new AtomicInteger();
        EventListener listener = e -> calls.incrementAndGet();
        dispatcher.on(EventMatcher.wildcard(), listener);
        dispatcher.on(EventMatcher.structured(Map.of("entity", "user")), listener);

        dispatcher.dispatch(event(EventPhase.PRE, null));

        assertEquals(1, calls.get());
    }

    @Test
    public void testFailingSyncListenerDoesNotStopOthers() {
        AtomicInteger calls = new AtomicInteger();
        dispatcher.on(EventMatcher.wildcard(), e -> {
            throw new IllegalStateException("listener failed");
        });
        dispatcher.on(EventMatcher.structured(Map.of("entity", "user")), e -> calls.incrementAndGet());

        assertDoesNotThrow(() -> dispatcher.dispatch(event(EventPhase.POST, null)));
        assertEquals(1, calls.get());
    }

    @Test
    public void testOffRemovesListener() {
        AtomicInteger calls = new AtomicInteger();
        EventListener listener = e -> calls.incrementAndGet();
        EventMatcher matcher = EventMatcher.structured(Map.of("phase", "pre"));
        dispatcher.on(matcher, listener);
        dispatcher.off(EventMatcher.structured(Map.of("phase", EventPhase.PRE)), listener);

        dispatcher.dispatch(event(EventPhase.PRE, null));

        assertEquals(0, calls.get());
    }

    @Test
    public void testAwaitAsyncHandlers() throws InterruptedException {
        DefaultEventDispatcher async = new DefaultEventDispatcher(Executors.newFixedThreadPool(2), Duration.ofSeconds(5));
        CountDownLatch started = new CountDownLatch(1);
        AtomicInteger completed = new AtomicInteger();
        async.onAsync(EventMatcher.wildcard(), e -> {
            started.countDown();
            Thread.sleep(50);
            completed.incrementAndGet();
        });
        async.onAsync(EventMatcher.wildcard(), e -> {
            throw new IllegalStateException("async listener failed");
        });

        async.dispatch(event(EventPhase.POST, null));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertDoesNotThrow(async::awaitAsyncHandlers);

        assertEquals(1, completed.get());
    }

    @Test
    public void testCandidateKeysForStructuredEvent() {
        EventMatcher type = EventMatcher.structured(Map.of("phase", "pre", "entity", "user"));

        Set<String> keys = DefaultEventDispatcher.candidateKeys(type);

        assertEquals(Set.of("entity:user|phase:pre", "entity:user", "phase:pre",
                EventMatcher.STRUCTURED_WILDCARD_KEY, EventMatcher.WILDCARD), keys);
        assertEquals(EventMatcher.WILDCARD, keys.iterator().next());
        assertEquals(EventMatcher.WILDCARD, DefaultEventDispatcher.candidateKeys(EventMatcher.of("user.created")).iterator().next());
    }

    @Test
    public void testWildcardListenersRunBeforeSpecificOnes() {
        List<String> order = new CopyOnWriteArrayList<>();
        dispatcher.on(EventMatcher.structured(Map.of("phase", "pre")), e -> order.add("pre"));
        dispatcher.on(EventMatcher.structured(Map.of()), e -> order.add("structured"));
        dispatcher.on(EventMatcher.wildcard(), e -> order.add("*"));
        dispatcher.on(EventMatcher.of("user.created"), e -> order.add("named"));

        dispatcher.dispatch(event(EventPhase.PRE, null));
        dispatcher.dispatch(EventPayload.builder().type(EventMatcher.of("user.created")).build());

        assertEquals(List.of("*", "pre", "structured", "*", "named"), order);
    }
}
