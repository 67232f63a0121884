package com.edge.match.core.event;

import java.util.Collections;
import java.util.List;

public class DetectedEvents {
    private final List<PossessionSegment> possessionSegments;
    private final List<PassEvent> passEvents;
    private final List<CarryEvent> carryEvents;
    private final List<TurnoverEvent> turnoverEvents;

    public DetectedEvents(List<PossessionSegment> possessionSegments, List<PassEvent> passEvents,
                          List<CarryEvent> carryEvents, List<TurnoverEvent> turnoverEvents) {
        this.possessionSegments = possessionSegments;
        this.passEvents = passEvents;
        this.carryEvents = carryEvents;
        this.turnoverEvents = turnoverEvents;
    }

    public static DetectedEvents empty() {
        return new DetectedEvents(Collections.emptyList(), Collections.emptyList(),
                Collections.emptyList(), Collections.emptyList());
    }

    public int totalEvents() {
        return passEvents.size() + carryEvents.size() + turnoverEvents.size();
    }

    public List<PossessionSegment> getPossessionSegments() { return possessionSegments; }
    public List<PassEvent> getPassEvents() { return passEvents; }
    public List<CarryEvent> getCarryEvents() { return carryEvents; }
    public List<TurnoverEvent> getTurnoverEvents() { return turnoverEvents; }
}
