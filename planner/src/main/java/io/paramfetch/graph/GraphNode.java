package io.paramfetch.graph;

public record GraphNode(String uuid, String id, String eventId, CaseBinding caseBinding) {
    public boolean hasEventId() {
        return eventId != null && !eventId.isBlank();
    }
}
