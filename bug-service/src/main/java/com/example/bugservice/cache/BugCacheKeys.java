package com.example.bugservice.cache;

import com.example.bugservice.repository.BugSearchCriteria;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.UUID;

/**
 * Cache key layout.
 * <ul>
 *   <li>{@code bug:<uuid>}</li>
 *   <li>{@code bugs:list:<sha256 hex>} of the length-prefixed query fields</li>
 * </ul>
 */
public final class BugCacheKeys {

    public static final String BUG_PREFIX = "bug:";
    public static final String LIST_PREFIX = "bugs:list:";
    public static final String LIST_PATTERN = LIST_PREFIX + "*";

    private BugCacheKeys() {
    }

    public static String bugKey(UUID bugId) {
        return BUG_PREFIX + bugId;
    }

    /**
     * Key for a normalised list query. Equal criteria always give the same key.
     */
    public static String listKey(BugSearchCriteria criteria) {
        StringBuilder canonical = new StringBuilder();
        append(canonical, String.valueOf(criteria.page()));
        append(canonical, String.valueOf(criteria.limit()));
        append(canonical, criteria.search());
        append(canonical, criteria.status() != null ? criteria.status().getValue() : null);
        append(canonical, criteria.priority() != null ? criteria.priority().getValue() : null);
        if (criteria.tags() == null) {
            append(canonical, null);
        } else {
            append(canonical, String.valueOf(criteria.tags().size()));
            criteria.tags().forEach(tag -> append(canonical, tag));
        }
        append(canonical, criteria.application());
        append(canonical, criteria.company());
        append(canonical, criteria.sort().getValue());
        return LIST_PREFIX + DigestUtils.sha256Hex(canonical.toString());
    }

    /**
     * Only the first page of an unsearched listing is cached.
     */
    public static boolean isCacheable(BugSearchCriteria criteria) {
        return criteria.page() == 1 && (criteria.search() == null || criteria.search().isEmpty());
    }

    // <length>:<value>, or "-" for null, so no field value can shift into its neighbour
    private static void append(StringBuilder canonical, String value) {
        if (value == null) {
            canonical.append('-');
        } else {
            canonical.append(value.length()).append(':').append(value);
        }
    }
}
