package net.slotwatch.core.util;

/**
 * 사용자에게 나가는 메시지 정리.
 * 제어문자 제거, 공백 축약, 꺾쇠 이스케이프 후 길이 제한.
 */
public final class MessageSanitizer {
    public static final int DEFAULT_MAX = 200;

    private MessageSanitizer() {}

    public static String sanitize(String raw) {
        return sanitize(raw, DEFAULT_MAX);
    }

    public static String sanitize(String raw, int max) {
        if (raw == null || max <= 0) return "";
        StringBuilder sb = new StringBuilder(raw.length());
        boolean pendingSpace = false;
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (Character.isWhitespace(ch)) {
                pendingSpace = sb.length() > 0;
                continue;
            }
            if (Character.isISOControl(ch)) continue;
            if (pendingSpace) {
                sb.append(' ');
                pendingSpace = false;
            }
            if (ch == '<') sb.append("&lt;");
            else if (ch == '>') sb.append("&gt;");
            else sb.append(ch);
        }
        return truncate(sb.toString(), max);
    }

    public static String truncate(String s, int max) {
        if (s == null || max <= 0) return "";
        return s.length() <= max ? s : s.substring(0, max);
    }
}
