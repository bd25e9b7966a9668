package io.indexer.core.events;

import java.time.Instant;
import java.util.Set;

/**
 * Point-in-time view of a subscription.
 *
 * @param lastEventTime null until the first delivery
 */
public record SubscriberInfo(String id,
                             Set<EventType> eventTypes,
                             long eventsReceived,
                             long eventsDropped,
                             int queued,
                             Instant createdAt,
                             Instant lastEventTime) {
}
