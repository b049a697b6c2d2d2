package net.slotwatch.core.model;

/**
 * 예약 시도 1회의 결과.
 * 실패는 예외가 아니라 값으로 돌려준다.
 */
public record BookingResult(boolean success, FailureKind kind, String message) {

    public enum FailureKind { RETRYABLE, TERMINAL }

    public BookingResult {
        if (success && kind != null) throw new IllegalArgumentException("success carries no failure kind");
        if (!success && kind == null) throw new IllegalArgumentException("failure needs a kind");
    }

    public static BookingResult succeeded(String message) {
        return new BookingResult(true, null, message);
    }

    public static BookingResult retryable(String message) {
        return new BookingResult(false, FailureKind.RETRYABLE, message);
    }

    public static BookingResult terminal(String message) {
        return new BookingResult(false, FailureKind.TERMINAL, message);
    }

    public boolean retryable() {
        return kind == FailureKind.RETRYABLE;
    }
}
