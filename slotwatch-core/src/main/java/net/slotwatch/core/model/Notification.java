package net.slotwatch.core.model;

public record Notification(
        Long monitoringId,
        long ownerId,
        Outcome outcome,
        CandidateSlot candidate,   // null 가능
        String message
) {
    public enum Outcome {
        FOUND,
        BOOKING,
        SUCCEEDED,
        FAILED,
        RETRYING,
        AUTH_REQUIRED,
        STOPPED_ON_RESTART
    }
}
