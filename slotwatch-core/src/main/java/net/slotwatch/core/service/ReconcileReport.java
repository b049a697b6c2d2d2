package net.slotwatch.core.service;

public record ReconcileReport(int started, int cancelled, int skippedRetiring, int running) {
    public boolean changed() {
        return started > 0 || cancelled > 0;
    }
}
