package com.researchplatform.webresearch.cache;

import com.researchplatform.common.model.SearchOptions;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Chooses how long a response stays cached, by content volatility:
 * news ages fastest, regulatory filings barely change.
 */
public class CacheTtlPolicy {

    public static final Duration SEARCH_NEWS     = Duration.ofHours(6);
    public static final Duration SEARCH_GENERAL  = Duration.ofHours(12);
    public static final Duration SEARCH_REGULATORY = Duration.ofHours(24);
    public static final Duration EXTRACT_INVESTOR_RELATIONS = Duration.ofHours(24);
    public static final Duration EXTRACT_REGULATORY = Duration.ofDays(7);
    public static final Duration EXTRACT_NEWS    = Duration.ofHours(12);

    private static final String REGULATORY_DOMAIN = "sec.gov";

    private final Set<String> newsDomains;

    public CacheTtlPolicy(Set<String> newsDomains) {
        this.newsDomains = Set.copyOf(newsDomains);
    }

    public Duration forSearch(SearchOptions options) {
        if (options == null) {
            return SEARCH_GENERAL;
        }
        List<String> include = options.includeDomains();
        if (include != null && !include.isEmpty()
                && include.stream().allMatch(CacheTtlPolicy::isRegulatory)) {
            return SEARCH_REGULATORY;
        }
        return options.isNews() ? SEARCH_NEWS : SEARCH_GENERAL;
    }

    public Duration forExtract(String url) {
        String host = hostOf(url);
        if (isRegulatory(host)) {
            return EXTRACT_REGULATORY;
        }
        if (newsDomains.stream().anyMatch(domain -> matchesDomain(host, domain))) {
            return EXTRACT_NEWS;
        }
        return EXTRACT_INVESTOR_RELATIONS;
    }

    private static boolean isRegulatory(String domainOrHost) {
        return matchesDomain(domainOrHost.toLowerCase(Locale.ROOT), REGULATORY_DOMAIN);
    }

    private static boolean matchesDomain(String host, String domain) {
        return host.equals(domain) || host.endsWith("." + domain);
    }

    private static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : "";
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
