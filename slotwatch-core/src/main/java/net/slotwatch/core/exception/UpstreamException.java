package net.slotwatch.core.exception;

/** 업스트림 호출 실패의 기반 예외 */
public class UpstreamException extends Exception {
    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
