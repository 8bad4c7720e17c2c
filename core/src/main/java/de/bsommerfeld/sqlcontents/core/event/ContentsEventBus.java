package de.bsommerfeld.sqlcontents.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus}. The contents manager and the
 * re-encryption pipeline publish {@link ContentsEvents} here after their
 * transaction committed; hosts subscribe for indexing, auditing or progress
 * display.
 *
 * <p>
 * A failing subscriber is logged and otherwise ignored: the operation that
 * posted the event has already committed.
 */
@Singleton
public class ContentsEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ContentsEventBus.class);
    private final EventBus eventBus;

    public ContentsEventBus() {
        this.eventBus = new EventBus(ContentsEventBus::logSubscriberFailure);
    }

    public void post(Object event) {
        // Per-row progress is too chatty for debug
        if (!(event instanceof ContentsEvents.RowReencryptedEvent)) {
            LOG.debug("Posting event: {}", event);
        }
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    private static void logSubscriberFailure(Throwable exception, SubscriberExceptionContext context) {
        LOG.error("Subscriber {}.{} failed on {}", context.getSubscriber().getClass().getSimpleName(),
                context.getSubscriberMethod().getName(), context.getEvent(), exception);
    }
}
