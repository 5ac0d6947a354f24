package com.decoadmin.backend.modules.organization.domain;

import java.util.Locale;

public final class EmailDomains {

    private EmailDomains() {
    }

    /**
     * Domain part of an email address: everything after the last {@code @}, lowercased.
     * Returns an empty string when the address has no usable local or domain part.
     */
    public static String extract(String email) {
        if (email == null) {
            return "";
        }
        String trimmed = email.trim();
        int at = trimmed.lastIndexOf('@');
        if (at <= 0 || at == trimmed.length() - 1) {
            return "";
        }
        return trimmed.substring(at + 1).toLowerCase(Locale.ROOT);
    }

    public static String normalizePolicyDomain(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("domain must not be blank");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        while (value.startsWith("@")) {
            value = value.substring(1);
        }
        if (value.isEmpty() || value.contains("@") || value.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Invalid domain: " + raw);
        }
        return "@" + value;
    }

    /**
     * Compares a stored policy entry ({@code @acme.com}) to a bare email domain ({@code acme.com}).
     */
    static boolean entryMatches(String policyEntry, String emailDomain) {
        if (policyEntry == null) {
            return false;
        }
        String entry = policyEntry.trim().toLowerCase(Locale.ROOT);
        if (entry.startsWith("@")) {
            entry = entry.substring(1);
        }
        return !entry.isEmpty() && entry.equals(emailDomain);
    }
}
