package com.decoadmin.backend.modules.organization.domain;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Pre-fills the organization setup form from the user's email domain.
 */
public final class CompanyNameSuggester {

    private static final String FAVICON_URL_TEMPLATE = "https://www.google.com/s2/favicons?domain=%s&sz=256";

    private CompanyNameSuggester() {
    }

    /**
     * {@code acme.com} becomes {@code Acme}; blank input yields an empty string.
     */
    public static String suggestName(String domain) {
        String host = normalizeCompanyHost(domain);
        if (host.isEmpty()) {
            return "";
        }
        String label = host.split("\\.")[0];
        if (label.isEmpty()) {
            return "";
        }
        return label.substring(0, 1).toUpperCase(Locale.ROOT) + label.substring(1);
    }

    public static String logoUrl(String domain) {
        String host = normalizeCompanyHost(domain);
        if (host.isEmpty()) {
            return "";
        }
        return FAVICON_URL_TEMPLATE.formatted(URLEncoder.encode(host, StandardCharsets.UTF_8));
    }

    /**
     * Accepts what people type in a "Company URL" box ({@code https://www.Acme.com/about})
     * and reduces it to the bare host ({@code acme.com}).
     */
    public static String normalizeCompanyHost(String companyUrl) {
        if (companyUrl == null) {
            return "";
        }
        String value = companyUrl.trim().toLowerCase(Locale.ROOT);
        int scheme = value.indexOf("://");
        if (scheme >= 0) {
            value = value.substring(scheme + 3);
        }
        int slash = value.indexOf('/');
        if (slash >= 0) {
            value = value.substring(0, slash);
        }
        int at = value.lastIndexOf('@');
        if (at >= 0) {
            value = value.substring(at + 1);
        }
        int port = value.indexOf(':');
        if (port >= 0) {
            value = value.substring(0, port);
        }
        if (value.startsWith("www.")) {
            value = value.substring(4);
        }
        return value;
    }
}
