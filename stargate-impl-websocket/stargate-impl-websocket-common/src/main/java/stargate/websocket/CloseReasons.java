package stargate.websocket;

import jakarta.websocket.CloseReason;

import java.nio.charset.StandardCharsets;

/**
 * Creates {@link CloseReason}s whose reason phrase always fits into a close frame.
 * <p>
 * A close frame allows at most 123 bytes of UTF-8 reason text, and the
 * {@link CloseReason} constructor throws if that is exceeded. Reason phrases here
 * often contain process names and exception messages of arbitrary length, so they
 * are cut at the last code point that still fits.
 */
public final class CloseReasons {
    public static final int MAX_REASON_BYTES = 123;

    private CloseReasons() {
    }

    public static CloseReason normal(String reason) {
        return of(CloseReason.CloseCodes.NORMAL_CLOSURE, reason);
    }

    public static CloseReason goingAway(String reason) {
        return of(CloseReason.CloseCodes.GOING_AWAY, reason);
    }

    /**
     * @param closeCode close code, must not be {@code null}
     * @param reason    reason phrase; {@code null} or empty yields a reason without phrase
     * @return the close reason
     */
    public static CloseReason of(CloseReason.CloseCode closeCode, String reason) {
        if (closeCode == null) {
            throw new IllegalArgumentException("closeCode cannot be null");
        }
        String phrase = truncate(reason);
        return new CloseReason(closeCode, phrase.isEmpty() ? null : phrase);
    }

    /**
     * @return the longest prefix of {@code reason} whose UTF-8 encoding fits into a close frame
     */
    public static String truncate(String reason) {
        if (reason == null) {
            return "";
        }
        if (reason.getBytes(StandardCharsets.UTF_8).length <= MAX_REASON_BYTES) {
            return reason;
        }
        int bytes = 0;
        int end = 0;
        while (end < reason.length()) {
            int codePoint = reason.codePointAt(end);
            int size = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (bytes + size > MAX_REASON_BYTES) {
                break;
            }
            bytes += size;
            end += Character.charCount(codePoint);
        }
        return reason.substring(0, end);
    }
}
