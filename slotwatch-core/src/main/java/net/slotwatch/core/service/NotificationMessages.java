package net.slotwatch.core.service;

import net.slotwatch.core.model.CandidateSlot;
import net.slotwatch.core.model.Monitoring;

import java.math.BigDecimal;

/** 사용자 알림 문구 */
public final class NotificationMessages {
    private NotificationMessages() {}

    public static String found(Monitoring m, CandidateSlot c) {
        return "Monitoring #" + m.id() + ": slot found at " + slot(c) + ". Starting auto-booking.";
    }

    public static String booking(Monitoring m, CandidateSlot c) {
        return "Monitoring #" + m.id() + ": booking " + slot(c) + " for order " + m.orderRef() + ".";
    }

    public static String retrying(Monitoring m, CandidateSlot c, int nextAttempt, int maxAttempts, String reason) {
        return "Monitoring #" + m.id() + ": booking " + c.date() + " failed (" + reason + "). Retrying, attempt "
                + nextAttempt + " of " + maxAttempts + ".";
    }

    public static String succeeded(Monitoring m, CandidateSlot c) {
        return "Monitoring #" + m.id() + ": booked " + slot(c) + " for order " + m.orderRef()
                + ". Monitoring finished.";
    }

    public static String failed(Monitoring m, CandidateSlot c, String reason) {
        if (c == null) return "Monitoring #" + m.id() + ": booking failed (" + reason + ").";
        return "Monitoring #" + m.id() + ": could not book " + slot(c) + " (" + reason + ").";
    }

    public static String excluded(Monitoring m, CandidateSlot c, String reason) {
        return failed(m, c, reason) + " Date " + c.date() + " is excluded, monitoring continues.";
    }

    public static String authRequired(Monitoring m, String reason) {
        return "Monitoring #" + m.id() + " paused: authorization required (" + reason + "). Sign in again and resume it.";
    }

    public static String stoppedOnRestart(Monitoring m) {
        return "Monitoring #" + m.id() + " was stopped because the service restarted. Start it again to keep watching.";
    }

    static String slot(CandidateSlot c) {
        return c.label() + " on " + c.date() + ", coefficient " + coefficient(c.coefficient())
                + (c.coefficient() == 0 ? " (free acceptance)" : "");
    }

    static String coefficient(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
