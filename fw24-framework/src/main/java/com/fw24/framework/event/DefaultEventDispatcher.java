package com.fw24.framework.event;

import com.fw24.framework.model.event.EventMatcher;
import com.fw24.framework.model.event.EventPayload;
import com.fw24.framework.util.ExceptionLoggingUtils;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Listener registry keyed by the canonical matcher key.
 * <p>
 * For a structured event with N dimensions every one of the 2^N dimension subsets is
 * looked up, the empty subset being the structured wildcard. N is small (five entity
 * dimensions at most) so the enumeration stays cheap. A listener reached through several
 * keys runs once per dispatch.
 */
public class DefaultEventDispatcher implements EventDispatcher {

    private static final Logger LOG = Logger.getLogger(DefaultEventDispatcher.class);
    public static final Duration DEFAULT_AWAIT_TIMEOUT = Duration.ofSeconds(30);

    private final Map<String, Set<EventListener>> syncListeners = new ConcurrentHashMap<>();
    private final Map<String, Set<EventListener>> asyncListeners = new ConcurrentHashMap<>();
    private final Map<String, List<CompletableFuture<Void>>> pendingAsync = new ConcurrentHashMap<>();
    private final Executor executor;
    private final Duration awaitTimeout;

    public DefaultEventDispatcher() {
        this(ForkJoinPool.commonPool(), DEFAULT_AWAIT_TIMEOUT);
    }

    public DefaultEventDispatcher(Executor executor, Duration awaitTimeout) {
        this.executor = executor;
        this.awaitTimeout = awaitTimeout == null ? DEFAULT_AWAIT_TIMEOUT : awaitTimeout;
    }

    @Override
    public void on(EventMatcher matcher, EventListener listener) {
        syncListeners.computeIfAbsent(matcher.key(), k -> new CopyOnWriteArraySet<>()).add(listener);
    }

    @Override
    public void onAsync(EventMatcher matcher, EventListener listener) {
        asyncListeners.computeIfAbsent(matcher.key(), k -> new CopyOnWriteArraySet<>()).add(listener);
    }

    @Override
    public void off(EventMatcher matcher, EventListener listener) {
        String key = matcher.key();
        Set<EventListener> sync = syncListeners.get(key);
        if (sync != null) {
            sync.remove(listener);
        }
        Set<EventListener> async = asyncListeners.get(key);
        if (async != null) {
            async.remove(listener);
        }
    }

    @Override
    public void dispatch(EventPayload<?> payload) {
        if (payload == null || payload.getType() == null) {
            LOG.warn("Ignoring event without a type");
            return;
        }
        if (payload.getTimestamp() == null) {
            payload.setTimestamp(Instant.now());
        }

        Set<EventListener> sync = new LinkedHashSet<>();
        Set<EventListener> async = new LinkedHashSet<>();
        for (String key : candidateKeys(payload.getType())) {
            sync.addAll(syncListeners.getOrDefault(key, Set.of()));
            async.addAll(asyncListeners.getOrDefault(key, Set.of()));
        }
        if (LOG.isDebugEnabled()) {
            LOG.debugf("Dispatching %s to %d sync and %d async listeners", payload.getType().key(), sync.size(), async.size());
        }

        for (EventListener listener : sync) {
            try {
                listener.onEvent(payload);
            } catch (Exception e) {
                ExceptionLoggingUtils.logError(LOG, e, "Error in synchronous event listener for %s", payload.getType().key());
            }
        }

        for (EventListener listener : async) {
            CompletableFuture<Void> future = CompletableFuture.runAsync(() -> {
                try {
                    listener.onEvent(payload);
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, executor);
            pendingAsync.computeIfAbsent(payload.getType().key(), k -> new CopyOnWriteArrayList<>()).add(future);
        }
    }

    @Override
    public void awaitAsyncHandlers() {
        for (String key : new ArrayList<>(pendingAsync.keySet())) {
            List<CompletableFuture<Void>> futures = pendingAsync.remove(key);
            if (futures == null) {
                continue;
            }
            for (CompletableFuture<Void> future : futures) {
                try {
                    future.get(awaitTimeout.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    ExceptionLoggingUtils.logError(LOG, e, "Interrupted awaiting asynchronous event listener for %s", key);
                    return;
                } catch (ExecutionException | TimeoutException e) {
                    ExceptionLoggingUtils.logError(LOG, ExceptionLoggingUtils.rootCause(e),
                            "Error awaiting asynchronous event listener for %s", key);
                }
            }
        }
    }

    /**
     * Keys a listener may be registered under to receive an event of this type,
     * the global wildcard first, then structured subsets from most to least specific.
     */
    static Set<String> candidateKeys(EventMatcher type) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(EventMatcher.WILDCARD);
        if (!type.isStructured()) {
            keys.add(type.getName());
            return keys;
        }
        List<Map.Entry<String, String>> dimensions = new ArrayList<>(type.getDimensions().entrySet());
        int n = dimensions.size();
        for (int mask = (1 << n) - 1; mask > 0; mask--) {
            Map<String, String> subset = new LinkedHashMap<>();
            for (int bit = 0; bit < n; bit++) {
                if ((mask & (1 << bit)) != 0) {
                    subset.put(dimensions.get(bit).getKey(), dimensions.get(bit).getValue());
                }
            }
            keys.add(EventMatcher.keyOf(subset));
        }
        keys.add(EventMatcher.STRUCTURED_WILDCARD_KEY);
        return keys;
    }
}
