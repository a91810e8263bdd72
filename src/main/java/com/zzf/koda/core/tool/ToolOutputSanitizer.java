package com.zzf.koda.core.tool;

import java.util.regex.Pattern;

/**
 * Masks credentials in text that leaves the process (tool observations, events, logs).
 */
public final class ToolOutputSanitizer {

    private static final Pattern SENSITIVE_KV = Pattern.compile("(?i)(password|passwd|secret|token|apikey|api_key|accesskey|secretkey)\\s*[:=]\\s*([\"']?)([^\"'\\\\\\r\\n\\s]{1,160})\\2");
    private static final Pattern SENSITIVE_JSON_KV = Pattern.compile("(?i)(\"(?:password|passwd|secret|token|apiKey|api_key|accessKey|secretKey)\"\\s*:\\s*\")([^\"]{1,160})(\")");
    private static final Pattern BEARER = Pattern.compile("(?i)(bearer\\s+)[A-Za-z0-9._\\-]{8,}");
    private static final Pattern OPENAI_KEY = Pattern.compile("sk-[A-Za-z0-9_\\-]{16,}");

    private ToolOutputSanitizer() {
    }

    public static String mask(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String masked = SENSITIVE_JSON_KV.matcher(text).replaceAll("$1******$3");
        masked = SENSITIVE_KV.matcher(masked).replaceAll("$1:******");
        masked = BEARER.matcher(masked).replaceAll("$1******");
        masked = OPENAI_KEY.matcher(masked).replaceAll("sk-******");
        return masked;
    }

    public static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "\n...(truncated " + (text.length() - maxChars) + " chars)";
    }
}
