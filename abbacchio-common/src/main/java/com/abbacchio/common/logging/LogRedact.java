package com.abbacchio.common.logging;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks connection tokens before they reach log output.
 */
public final class LogRedact {

    private LogRedact() {
    }

    public enum RedactMode {
        OFF,
        ON;

        public static RedactMode normalize(String value) {
            if ("off".equalsIgnoreCase(value)) {
                return OFF;
            }
            return ON;
        }
    }

    private static final int MIN_TOKEN_LENGTH = 18;
    private static final int KEEP_START = 6;
    private static final int KEEP_END = 4;

    private static volatile RedactMode mode = RedactMode.ON;

    private static final List<Pattern> PATTERNS = List.of(
            // JWT (header.payload.signature)
            Pattern.compile("\\b(eyJ[A-Za-z0-9_-]{5,}\\.[A-Za-z0-9_-]{5,}\\.[A-Za-z0-9_-]+)"),
            // JSON fields
            Pattern.compile("\"(?:token|secret|password)\"\\s*:\\s*\"([^\"]+)\"", Pattern.CASE_INSENSITIVE),
            // Query parameters
            Pattern.compile("[?&](?:token|access_token|key)=([^&#\\s]+)", Pattern.CASE_INSENSITIVE),
            // Authorization headers
            Pattern.compile("\\bBearer\\s+([A-Za-z0-9._\\-+=]{8,})", Pattern.CASE_INSENSITIVE));

    private static final Pattern URL_USERINFO = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.-]*://)([^/@]+)@");

    public static void setMode(RedactMode redactMode) {
        mode = redactMode != null ? redactMode : RedactMode.ON;
    }

    public static RedactMode getMode() {
        return mode;
    }

    /**
     * Mask a token keeping only its first and last few characters.
     */
    public static String maskToken(String token) {
        if (token == null || token.isEmpty()) {
            return "";
        }
        if (mode == RedactMode.OFF) {
            return token;
        }
        if (token.length() < MIN_TOKEN_LENGTH) {
            return "***";
        }
        return token.substring(0, KEEP_START) + "…" + token.substring(token.length() - KEEP_END);
    }

    /**
     * Strip credentials from a URL: user-info and token-like query values.
     */
    public static String redactUrl(String url) {
        if (url == null || url.isEmpty() || mode == RedactMode.OFF) {
            return url;
        }
        String stripped = URL_USERINFO.matcher(url).replaceFirst("$1***@");
        return redactSensitiveText(stripped);
    }

    /**
     * Mask every recognised secret inside free text.
     */
    public static String redactSensitiveText(String text) {
        if (text == null || text.isEmpty() || mode == RedactMode.OFF) {
            return text;
        }
        String result = text;
        for (Pattern pattern : PATTERNS) {
            result = replaceGroup(result, pattern);
        }
        return result;
    }

    private static String replaceGroup(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            int start = matcher.start(1);
            int end = matcher.end(1);
            sb.append(text, last, start);
            sb.append(maskToken(matcher.group(1)));
            last = end;
        }
        sb.append(text, last, text.length());
        return sb.toString();
    }
}
