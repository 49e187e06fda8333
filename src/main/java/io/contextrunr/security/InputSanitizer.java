package io.contextrunr.security;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Cleans transport text and ids before they are recorded.
 */
@Component
public class InputSanitizer {

    private static final int MAX_MESSAGE_LENGTH = 10_000;
    private static final int MAX_ID_LENGTH = 256;
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    /**
     * Removes control characters (newlines and tabs are kept) and truncates overly long text.
     *
     * @param content the raw message text
     * @return sanitized text, empty for null
     */
    public String sanitize(String content) {
        if (content == null) return "";

        String cleaned = CONTROL_CHARS.matcher(content).replaceAll("");
        if (cleaned.length() > MAX_MESSAGE_LENGTH) {
            cleaned = cleaned.substring(0, MAX_MESSAGE_LENGTH) + "... [truncated]";
        }
        return cleaned;
    }

    /**
     * Validates a conversation, message or participant id.
     *
     * @param value the id
     * @param field field name for the error message
     * @return the trimmed id
     * @throws IllegalArgumentException if the id is blank, too long or contains control characters
     */
    public String requireId(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_ID_LENGTH) {
            throw new IllegalArgumentException(field + " is too long (max " + MAX_ID_LENGTH + ")");
        }
        if (CONTROL_CHARS.matcher(trimmed).find()) {
            throw new IllegalArgumentException(field + " contains control characters");
        }
        return trimmed;
    }
}
