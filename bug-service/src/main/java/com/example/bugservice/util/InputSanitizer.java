package com.example.bugservice.util;

import org.springframework.web.util.HtmlUtils;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Sanitisation and validation of user supplied text.
 *
 * Malicious patterns are checked on the raw input before escaping,
 * so escaped output never hides a script tag from the check.
 */
public final class InputSanitizer {

    public static final int MAX_TAGS = 10;
    public static final int MAX_TAG_LENGTH = 50;
    public static final int MAX_URL_LENGTH = 2048;
    public static final int MAX_EMAIL_LENGTH = 254;

    private static final List<String> MALICIOUS_PATTERNS = List.of(
            "<script", "</script", "javascript:", "data:", "vbscript:",
            "onload=", "onerror=", "onclick=", "onmouseover="
    );

    private static final List<String> SUSPICIOUS_URL_PATTERNS = List.of("file:", "ftp:");

    // Control characters except \t (0x09) and \n (0x0A)
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B-\\x1F\\x7F]");

    private static final Pattern URL_PATTERN =
            Pattern.compile("^https?://[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}(/.*)?$");

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private static final Pattern TAG_PATTERN = Pattern.compile("^[a-z0-9 _-]+$");

    private InputSanitizer() {
    }

    /**
     * Strip control characters, HTML-escape and trim. Null stays null.
     */
    public static String sanitize(String input) {
        if (input == null) {
            return null;
        }
        String stripped = CONTROL_CHARS.matcher(input).replaceAll("");
        return HtmlUtils.htmlEscape(stripped).trim();
    }

    public static boolean containsMaliciousContent(String input) {
        if (input == null) {
            return false;
        }
        String lower = input.toLowerCase(Locale.ROOT);
        return MALICIOUS_PATTERNS.stream().anyMatch(lower::contains);
    }

    /**
     * Sanitise a required string and check its length.
     *
     * @return the sanitised value, or empty when missing, malicious or out of bounds
     */
    public static Optional<String> validateString(String input, int minLength, int maxLength) {
        if (input == null || containsMaliciousContent(input)) {
            return Optional.empty();
        }
        String sanitized = sanitize(input);
        if (sanitized.length() < minLength || sanitized.length() > maxLength) {
            return Optional.empty();
        }
        return Optional.of(sanitized);
    }

    public static Optional<String> validateUrl(String url) {
        if (url == null) {
            return Optional.empty();
        }
        String trimmed = url.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_URL_LENGTH) {
            return Optional.empty();
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (containsMaliciousContent(trimmed) || SUSPICIOUS_URL_PATTERNS.stream().anyMatch(lower::contains)) {
            return Optional.empty();
        }
        if (!URL_PATTERN.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        return Optional.of(trimmed);
    }

    public static Optional<String> validateEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        String trimmed = email.trim();
        if (trimmed.length() > MAX_EMAIL_LENGTH || !EMAIL_PATTERN.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        return Optional.of(trimmed);
    }

    /**
     * Trim and lower-case tags, silently dropping invalid ones and collapsing duplicates.
     * The caller enforces {@link #MAX_TAGS} on the raw list.
     */
    public static Set<String> normalizeTags(Collection<String> tags) {
        Set<String> normalized = new LinkedHashSet<>();
        if (tags == null) {
            return normalized;
        }
        for (String tag : tags) {
            if (tag == null) {
                continue;
            }
            String value = tag.trim().toLowerCase(Locale.ROOT);
            if (value.isEmpty() || value.length() > MAX_TAG_LENGTH || !TAG_PATTERN.matcher(value).matches()) {
                continue;
            }
            normalized.add(value);
        }
        return normalized;
    }
}
