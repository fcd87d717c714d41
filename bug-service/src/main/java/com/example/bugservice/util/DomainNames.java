package com.example.bugservice.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Domain derivation for company resolution and claim checks.
 *
 * A derived domain ending in ".app" is a placeholder for a company page
 * nobody has claimed; no email can ever match it.
 */
public final class DomainNames {

    public static final String PLACEHOLDER_SUFFIX = ".app";

    private static final String WWW_PREFIX = "www.";

    private DomainNames() {
    }

    /**
     * URL input gives its host; dotted input is taken as a domain;
     * anything else becomes a placeholder ("My App" gives "my-app.app").
     */
    public static String deriveDomain(String input) {
        String value = input.trim();
        String lower = value.toLowerCase(Locale.ROOT);

        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return host(value);
        }
        if (lower.contains(".")) {
            return stripWww(lower);
        }
        return lower.replace(' ', '-') + PLACEHOLDER_SUFFIX;
    }

    /**
     * First label of the URL host without "www.", title-cased ("https://www.acme.com" gives "Acme").
     */
    public static String companyNameFromUrl(String url) {
        String host = stripWww(host(url.trim()));
        int dot = host.indexOf('.');
        String label = dot > 0 ? host.substring(0, dot) : host;
        if (label.isEmpty()) {
            return label;
        }
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }

    public static boolean isPlaceholder(String domain) {
        return domain != null && stripWww(domain.toLowerCase(Locale.ROOT)).endsWith(PLACEHOLDER_SUFFIX);
    }

    /**
     * Whether the email's domain is exactly the company domain (case-insensitive).
     */
    public static boolean isEmailFromDomain(String email, String domain) {
        if (email == null || domain == null) {
            return false;
        }
        int at = email.indexOf('@');
        if (at < 0 || at != email.lastIndexOf('@')) {
            return false;
        }
        if (isPlaceholder(domain)) {
            return false;
        }
        String emailDomain = email.substring(at + 1).toLowerCase(Locale.ROOT);
        return emailDomain.equals(domain.toLowerCase(Locale.ROOT));
    }

    private static String host(String url) {
        try {
            String host = new URI(url).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : hostFromAuthority(url);
        } catch (URISyntaxException e) {
            return hostFromAuthority(url);
        }
    }

    // Lenient fallback for inputs java.net.URI rejects (underscores, spaces)
    private static String hostFromAuthority(String url) {
        String withoutScheme = url.substring(url.indexOf("://") + 3);
        int end = withoutScheme.length();
        for (char c : new char[]{'/', '?', '#', ':'}) {
            int idx = withoutScheme.indexOf(c);
            if (idx >= 0 && idx < end) {
                end = idx;
            }
        }
        return withoutScheme.substring(0, end).toLowerCase(Locale.ROOT);
    }

    private static String stripWww(String domain) {
        return domain.startsWith(WWW_PREFIX) ? domain.substring(WWW_PREFIX.length()) : domain;
    }
}
