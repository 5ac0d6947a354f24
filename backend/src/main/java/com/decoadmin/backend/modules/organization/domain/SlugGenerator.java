package com.decoadmin.backend.modules.organization.domain;

import java.util.Locale;
import java.util.regex.Pattern;

public final class SlugGenerator {

    /**
     * Longest base slug. The organization.slug column holds 140 characters, which leaves room
     * for a collision suffix such as "-1001".
     */
    public static final int MAX_LENGTH = 130;

    private static final Pattern NON_SLUG_RUN = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");

    private SlugGenerator() {
    }

    /**
     * "Acme Inc." becomes "acme-inc". An input without any [a-z0-9] yields "".
     * The result is cut to {@link #MAX_LENGTH}; lowercasing may lengthen a name
     * ("İ" becomes "i" plus a combining dot), so the name length alone does not bound it.
     */
    public static String slugify(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        String lowered = name.toLowerCase(Locale.ROOT);
        String dashed = NON_SLUG_RUN.matcher(lowered).replaceAll("-");
        String slug = EDGE_DASHES.matcher(dashed).replaceAll("");
        if (slug.length() > MAX_LENGTH) {
            slug = EDGE_DASHES.matcher(slug.substring(0, MAX_LENGTH)).replaceAll("");
        }
        return slug;
    }

    /**
     * Candidate slug for the given 1-based attempt: the base itself first, then base-2, base-3, ...
     */
    public static String withSuffix(String baseSlug, int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        return attempt == 1 ? baseSlug : baseSlug + "-" + attempt;
    }
}
