package net.slotwatch.core.exception;

/** 토큰/세션이 없거나 거부됨. 사용자 재인증 전까지 진행 불가. */
public class UpstreamAuthException extends UpstreamException {
    public UpstreamAuthException(String message) {
        super(message);
    }

    public UpstreamAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
