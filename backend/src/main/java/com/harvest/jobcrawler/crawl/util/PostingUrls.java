package com.harvest.jobcrawler.crawl.util;

import com.harvest.jobcrawler.crawl.model.SourcePlatform;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PostingUrls {
    private static final Pattern JOB_104 = Pattern.compile("job/([^/?#]+)");
    private static final Pattern JOB_1111 = Pattern.compile("job/(\\d+)");
    private static final Pattern JOB_YOURATOR = Pattern.compile("jobs/(\\d+)");
    private static final Pattern YES123_P_ID = Pattern.compile("p_id=([^&#]+)");
    private static final Pattern YES123_JOB_ID = Pattern.compile("job_id=([^&#]+)");
    private static final Pattern COMPANY_104 = Pattern.compile("company/([^/?#]+)");
    private static final Pattern COMPANY_1111 = Pattern.compile("corp/(\\d+)");
    private static final Pattern COMPANY_PATH = Pattern.compile("companies/([^/?#]+)");

    private PostingUrls() {
    }

    /**
     * Drops the fragment and, unless the source keeps it, the query string, so repeated discovery of the same
     * posting converges on one URL.
     */
    public static String normalize(String url, SourcePlatform source) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String value = url.trim();
        int fragment = value.indexOf('#');
        if (fragment >= 0) {
            value = value.substring(0, fragment);
        }
        if (source == null || !source.queryIdentifiesPosting()) {
            int query = value.indexOf('?');
            if (query >= 0) {
                value = value.substring(0, query);
            }
        }
        return value.isBlank() ? null : value;
    }

    public static List<String> normalizeAll(Collection<String> urls, SourcePlatform source, int limit) {
        Set<String> unique = new LinkedHashSet<>();
        for (String url : urls) {
            String normalized = normalize(url, source);
            if (normalized != null) {
                unique.add(normalized);
            }
            if (limit > 0 && unique.size() >= limit) {
                break;
            }
        }
        return new ArrayList<>(unique);
    }

    /**
     * Resolves protocol-relative and root-relative links against the source base URL.
     */
    public static String absolutize(String link, String baseUrl) {
        if (link == null || link.isBlank()) {
            return null;
        }
        String value = link.trim();
        if (value.startsWith("//")) {
            return "https:" + value;
        }
        if (value.startsWith("http://") || value.startsWith("https://")) {
            return value;
        }
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return value.startsWith("/") ? base + value : base + "/" + value;
    }

    public static String sourceIdFromUrl(SourcePlatform source, String url) {
        if (source == null || url == null || url.isBlank()) {
            return null;
        }
        return switch (source) {
            case PLATFORM_104 -> firstGroup(JOB_104, url);
            case PLATFORM_1111 -> firstGroup(JOB_1111, url);
            case PLATFORM_YOURATOR -> firstGroup(JOB_YOURATOR, url);
            case PLATFORM_YES123 -> yes123Id(url);
            case PLATFORM_CAKERESUME -> lastPathSegment(url);
        };
    }

    /**
     * Organization id carried by a posting URL. Only Yourator and CakeResume nest postings under the company
     * path; the other sources need the company link from the page.
     */
    public static String companyIdFromPostingUrl(SourcePlatform source, String postingUrl) {
        if (source == null || postingUrl == null || postingUrl.isBlank()) {
            return null;
        }
        return switch (source) {
            case PLATFORM_YOURATOR, PLATFORM_CAKERESUME -> firstGroup(COMPANY_PATH, postingUrl);
            case PLATFORM_104, PLATFORM_1111, PLATFORM_YES123 -> null;
        };
    }

    /**
     * Organization id from a company page link such as {@code hiringOrganization.sameAs}.
     */
    public static String companyIdFromUrl(SourcePlatform source, String url) {
        if (source == null || url == null || url.isBlank()) {
            return null;
        }
        return switch (source) {
            case PLATFORM_104 -> firstGroup(COMPANY_104, url);
            case PLATFORM_1111 -> firstGroup(COMPANY_1111, url);
            case PLATFORM_YOURATOR -> firstGroup(COMPANY_PATH, url);
            case PLATFORM_YES123 -> yes123CompanyId(url);
            case PLATFORM_CAKERESUME -> firstGroup(COMPANY_PATH, url);
        };
    }

    public static String host(String url) {
        URI uri = safeUri(url);
        return uri == null || uri.getHost() == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static String yes123Id(String url) {
        String pId = firstGroup(YES123_P_ID, url);
        return pId != null ? pId : firstGroup(YES123_JOB_ID, url);
    }

    private static String yes123CompanyId(String url) {
        String pId = firstGroup(YES123_P_ID, url);
        return pId == null || pId.toLowerCase(Locale.ROOT).contains("yes123") ? null : pId;
    }

    private static String firstGroup(Pattern pattern, String value) {
        Matcher matcher = pattern.matcher(value);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static String lastPathSegment(String url) {
        String value = normalize(url, null);
        if (value == null) {
            return null;
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        int slash = value.lastIndexOf('/');
        String segment = slash >= 0 ? value.substring(slash + 1) : value;
        return segment.isBlank() ? null : segment;
    }
}
