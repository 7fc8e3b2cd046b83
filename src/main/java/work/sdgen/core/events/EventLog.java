package work.sdgen.core.events;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only, replayable log of run events. Subscribers may join late and replay what happened so far.
 * Thread-safe; events are delivered in sequence order.
 */
public final class EventLog {
    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    private final List<RunEvent> events = new ArrayList<>();
    private final CopyOnWriteArrayList<Consumer<RunEvent>> subscribers = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public EventLog() {
        this(Clock.systemUTC());
    }

    public EventLog(Clock clock) {
        this.clock = clock;
    }

    public synchronized RunEvent publish(EventType type, String phase, Map<String, Object> payload) {
        var event = new RunEvent(events.size() + 1L, type, Optional.ofNullable(phase), payload, clock.instant());
        events.add(event);
        log.debug("Event #{} {} {}", event.sequence(), type, phase == null ? "" : phase);
        for (Consumer<RunEvent> subscriber : subscribers) {
            deliverSafely(subscriber, event);
        }
        return event;
    }

    /**
     * Subscribes to future events; with {@code replay} the subscriber first receives every past event.
     */
    public synchronized Subscription subscribe(Consumer<RunEvent> subscriber, boolean replay) {
        if (replay) {
            for (RunEvent event : events) {
                deliverSafely(subscriber, event);
            }
        }
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    public synchronized List<RunEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<RunEvent> subscriber, RunEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}", event.type(), e.getMessage(), e);
        }
    }
}
