package net.slotwatch.core.model;

public enum MonitoringStatus {
    ACTIVE, PAUSED, STOPPED, COMPLETED;

    public static MonitoringStatus from(String s) {
        return MonitoringStatus.valueOf(s.trim().toUpperCase());
    }
}
