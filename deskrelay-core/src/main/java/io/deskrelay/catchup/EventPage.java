package io.deskrelay.catchup;

import io.deskrelay.event.TicketEvent;

import java.util.List;
import java.util.OptionalLong;

/**
 * One page of a ticket's event log.
 *
 * @param events     events in ascending id order
 * @param nextCursor id of the last event, to pass as {@code afterId} for the next page;
 *                   empty when the page is empty
 */
public record EventPage(List<TicketEvent> events, OptionalLong nextCursor) {

    public EventPage {
        events = List.copyOf(events);
    }

    static EventPage of(List<TicketEvent> events) {
        if (events.isEmpty()) {
            return new EventPage(List.of(), OptionalLong.empty());
        }
        return new EventPage(events, OptionalLong.of(events.get(events.size() - 1).id()));
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
