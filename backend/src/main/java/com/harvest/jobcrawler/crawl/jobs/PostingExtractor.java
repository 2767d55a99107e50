package com.harvest.jobcrawler.crawl.jobs;

import com.harvest.jobcrawler.crawl.model.ExtractedPage;
import com.harvest.jobcrawler.crawl.model.JobLocation;
import com.harvest.jobcrawler.crawl.model.JobPosting;
import com.harvest.jobcrawler.crawl.model.Organization;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.harvest.jobcrawler.crawl.util.PostingUrls;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads schema.org {@code JobPosting} JSON-LD out of a posting page. Malformed input never throws; the
 * affected parts come back as null.
 */
@Component
public class PostingExtractor {
    private static final Logger log = LoggerFactory.getLogger(PostingExtractor.class);
    private static final Set<String> JOB_POSTING_TYPES = Set.of("jobposting");
    private static final Set<String> ORGANIZATION_TYPES = Set.of("organization", "corporation", "localbusiness");

    private final ObjectMapper objectMapper;

    public PostingExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExtractedPage extract(SourcePlatform source, String html, String url) {
        if (html == null || html.isBlank()) {
            return new ExtractedPage(null, null, null, null);
        }
        try {
            Document document = Jsoup.parse(html, url == null ? "" : url);
            String pageTitle = blankToNull(document.title());
            JsonNode node = findTyped(document, JOB_POSTING_TYPES);
            if (node == null) {
                return new ExtractedPage(pageTitle, null, null, null);
            }
            JobPosting posting = toPosting(source, node, url);
            Organization organization = toOrganization(source, node.path("hiringOrganization"), url);
            JobLocation location = posting == null ? null : nativeLocation(node.get("jobLocation"), posting.address());
            return new ExtractedPage(pageTitle, posting, organization, location);
        } catch (RuntimeException e) {
            log.warn("Extraction failed source={} url={} error={}", source.code(), url, e.getMessage());
            return new ExtractedPage(null, null, null, null);
        }
    }

    public JobPosting extractPosting(SourcePlatform source, String html, String url) {
        return extract(source, html, url).posting();
    }

    /**
     * Reads the hiring organization of a posting page, or a standalone {@code Organization} block such as a
     * company page carries.
     */
    public Organization extractOrganization(SourcePlatform source, String html, String url) {
        if (html == null || html.isBlank()) {
            return null;
        }
        try {
            Document document = Jsoup.parse(html, url == null ? "" : url);
            JsonNode posting = findTyped(document, JOB_POSTING_TYPES);
            if (posting != null) {
                return toOrganization(source, posting.path("hiringOrganization"), url);
            }
            JsonNode organization = findTyped(document, ORGANIZATION_TYPES);
            return organization == null ? null : toOrganization(source, organization, url);
        } catch (RuntimeException e) {
            log.warn("Organization extraction failed source={} url={} error={}", source.code(), url, e.getMessage());
            return null;
        }
    }

    private JsonNode findTyped(Document document, Set<String> types) {
        List<JsonNode> matches = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                collectTypedNodes(objectMapper.readTree(payload), types, matches);
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block: {}", e.getOriginalMessage());
            }
        }
        return matches.isEmpty() ? null : matches.get(0);
    }

    private void collectTypedNodes(JsonNode node, Set<String> types, List<JsonNode> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isObject()) {
            if (isType(node.get("@type"), types)) {
                out.add(node);
            }
            node.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                if (value.isArray() || value.isObject()) {
                    collectTypedNodes(value, types, out);
                }
            });
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectTypedNodes(child, types, out);
            }
        }
    }

    private boolean isType(JsonNode typeNode, Set<String> types) {
        if (typeNode == null || typeNode.isNull()) {
            return false;
        }
        if (typeNode.isTextual()) {
            return types.contains(typeNode.asText().toLowerCase(Locale.ROOT));
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && types.contains(child.asText().toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        return false;
    }

    private JobPosting toPosting(SourcePlatform source, JsonNode node, String url) {
        String title = firstNonBlank(text(node, "title"), text(node, "name"));
        String sourceId = firstNonBlank(PostingUrls.sourceIdFromUrl(source, url), identifier(node.get("identifier")));
        if (sourceId == null) {
            log.debug("No source id for source={} url={}", source.code(), url);
            return null;
        }
        JsonNode organization = node.path("hiringOrganization");
        JsonNode salaryValue = node.path("baseSalary").path("value");
        Long salaryMin = amount(firstPresent(salaryValue.get("minValue"), salaryValue.get("value")));
        Long salaryMax = amount(firstPresent(salaryValue.get("maxValue"), salaryValue.get("value")));
        return new JobPosting(
            source,
            sourceId,
            url,
            title,
            organizationId(source, organization),
            text(organization, "name"),
            plainText(text(node, "description")),
            address(node.get("jobLocation")),
            employmentType(node.get("employmentType")),
            salaryMin,
            salaryMax,
            firstNonBlank(text(salaryValue, "unitText"), text(node.path("baseSalary"), "unitText")),
            parseDate(text(node, "datePosted")),
            JobPosting.LAYER_NATIVE,
            node.toString()
        );
    }

    private Organization toOrganization(SourcePlatform source, JsonNode organization, String postingUrl) {
        String name = text(organization, "name");
        if (name == null) {
            return null;
        }
        String sourceId = organizationId(source, organization);
        if (sourceId == null) {
            sourceId = PostingUrls.companyIdFromPostingUrl(source, postingUrl);
        }
        return new Organization(
            source,
            sourceId,
            name,
            firstNonBlank(text(organization, "sameAs"), text(organization, "url")),
            address(organization.get("address")),
            plainText(text(organization, "description")),
            JobPosting.LAYER_NATIVE
        );
    }

    private String organizationId(SourcePlatform source, JsonNode organization) {
        String link = firstNonBlank(text(organization, "sameAs"), text(organization, "url"));
        return link == null ? null : PostingUrls.companyIdFromUrl(source, link);
    }

    private JobLocation nativeLocation(JsonNode jobLocation, String address) {
        if (jobLocation == null || jobLocation.isNull()) {
            return null;
        }
        JsonNode place = jobLocation.isArray() ? jobLocation.path(0) : jobLocation;
        JsonNode geo = place.path("geo");
        Double latitude = coordinate(geo.get("latitude"));
        Double longitude = coordinate(geo.get("longitude"));
        if (latitude == null || longitude == null) {
            return null;
        }
        return new JobLocation(latitude, longitude, address, JobLocation.PROVIDER_NATIVE);
    }

    private String address(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        LinkedHashSet<String> addresses = new LinkedHashSet<>();
        collectAddresses(node, addresses);
        return addresses.isEmpty() ? null : String.join(" | ", addresses);
    }

    private void collectAddresses(JsonNode node, LinkedHashSet<String> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                collectAddresses(item, out);
            }
            return;
        }
        if (node.isTextual()) {
            String value = node.asText().trim();
            if (!value.isEmpty()) {
                out.add(value);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        JsonNode address = node.has("address") ? node.get("address") : node;
        if (address.isTextual()) {
            collectAddresses(address, out);
            return;
        }
        // Taiwanese addresses read region, locality, street without separators.
        StringBuilder joined = new StringBuilder();
        appendIfPresent(joined, text(address, "addressRegion"));
        appendIfPresent(joined, text(address, "addressLocality"));
        appendIfPresent(joined, text(address, "streetAddress"));
        if (joined.length() > 0) {
            out.add(joined.toString());
            return;
        }
        String fallback = firstNonBlank(text(node, "name"), text(address, "name"));
        if (fallback != null) {
            out.add(fallback);
        }
    }

    private String employmentType(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode item : node) {
                if (item.isTextual()) {
                    values.add(item.asText());
                }
            }
            if (!values.isEmpty()) {
                return values.stream().distinct().collect(Collectors.joining(", "));
            }
        }
        return node.toString();
    }

    private String identifier(JsonNode identifierNode) {
        if (identifierNode == null || identifierNode.isNull()) {
            return null;
        }
        if (identifierNode.isTextual() || identifierNode.isNumber()) {
            return blankToNull(identifierNode.asText());
        }
        if (identifierNode.isObject()) {
            return firstNonBlank(text(identifierNode, "value"), text(identifierNode, "name"));
        }
        return null;
    }

    private Long amount(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            String digits = node.asText().replaceAll("[^0-9.]", "");
            if (digits.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(digits).longValue();
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private Double coordinate(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private LocalDate parseDate(String rawDate) {
        if (rawDate == null || rawDate.isBlank()) {
            return null;
        }
        String candidate = rawDate.trim();
        if (candidate.length() >= 10) {
            candidate = candidate.substring(0, 10);
        }
        try {
            return LocalDate.parse(candidate);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private String plainText(String html) {
        if (html == null) {
            return null;
        }
        return blankToNull(Jsoup.parse(html).text().replace('\u00a0', ' ').strip());
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            return blankToNull(value.asText().trim());
        }
        if (value.isArray() && value.size() > 0 && value.get(0).isTextual()) {
            return blankToNull(value.get(0).asText().trim());
        }
        return null;
    }

    private static JsonNode firstPresent(JsonNode... nodes) {
        for (JsonNode node : nodes) {
            if (node != null && !node.isNull()) {
                return node;
            }
        }
        return null;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static void appendIfPresent(StringBuilder builder, String value) {
        if (value != null && !value.isBlank()) {
            builder.append(value.trim());
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
