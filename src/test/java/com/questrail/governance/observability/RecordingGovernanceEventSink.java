package com.questrail.governance.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingGovernanceEventSink implements GovernanceEventSink {
    private final List<GovernanceEvent> events = new ArrayList<>();
    private final List<OperationRejectedEvent> rejections = new ArrayList<>();
    private final List<LedgerErrorEvent> errors = new ArrayList<>();

    @Override
    public synchronized void onEvent(GovernanceEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onRejected(OperationRejectedEvent event) {
        rejections.add(event);
    }

    @Override
    public synchronized void onError(LedgerErrorEvent event) {
        errors.add(event);
    }

    public synchronized List<GovernanceEvent> getEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<OperationRejectedEvent> getRejections() {
        return new ArrayList<>(rejections);
    }

    public synchronized List<LedgerErrorEvent> getErrors() {
        return new ArrayList<>(errors);
    }

    public synchronized <T extends GovernanceEvent> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T extends GovernanceEvent> T lastEventOfType(Class<T> type) {
        List<T> matching = eventsOfType(type);
        if (matching.isEmpty()) {
            throw new AssertionError("No event of type " + type.getSimpleName());
        }
        return matching.get(matching.size() - 1);
    }

    public synchronized void clear() {
        events.clear();
        rejections.clear();
        errors.clear();
    }
}
