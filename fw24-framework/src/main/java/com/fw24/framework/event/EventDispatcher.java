package com.fw24.framework.event;

import com.fw24.framework.model.event.EventMatcher;
import com.fw24.framework.model.event.EventPayload;

/**
 * Structured publish / subscribe.
 * <p>
 * A listener registered for a structured matcher receives every structured event whose
 * dimensions include all of the listener's dimensions. A listener registered for
 * {@link EventMatcher#WILDCARD} receives every event. Listener failures are logged and
 * never reach the dispatching caller.
 */
public interface EventDispatcher {

    /**
     * Registers a listener that runs inside {@link #dispatch(EventPayload)}, in
     * registration order.
     */
    void on(EventMatcher matcher, EventListener listener);

    /**
     * Registers a listener that is started by {@link #dispatch(EventPayload)} but not
     * waited for; see {@link #awaitAsyncHandlers()}.
     */
    void onAsync(EventMatcher matcher, EventListener listener);

    /**
     * Removes the listener from both the synchronous and asynchronous registrations.
     */
    void off(EventMatcher matcher, EventListener listener);

    void dispatch(EventPayload<?> payload);

    /**
     * Waits for every asynchronous listener started so far, logging failures, and
     * forgets them.
     */
    void awaitAsyncHandlers();
}
