package com.harvest.jobcrawler.crawl.persistence;

import com.harvest.jobcrawler.crawl.model.Category;
import com.harvest.jobcrawler.crawl.model.CompanyProfile;
import com.harvest.jobcrawler.crawl.model.JobLocation;
import com.harvest.jobcrawler.crawl.model.JobPosting;
import com.harvest.jobcrawler.crawl.model.Organization;
import com.harvest.jobcrawler.crawl.model.PlatformHealth;
import com.harvest.jobcrawler.crawl.model.SkillTag;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.harvest.jobcrawler.crawl.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

@Repository
public class CrawlJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(CrawlJdbcRepository.class);
    private static final double LATENCY_SMOOTHING = 0.1;

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public CrawlJdbcRepository(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactionTemplate, Clock clock) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    // Categories and checkpoints

    public void upsertCategory(Category category, int listingOrder) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("source", category.source().code())
            .addValue("layer1Id", category.layer1Id())
            .addValue("layer1Name", category.layer1Name())
            .addValue("layer2Id", category.layer2Id())
            .addValue("layer2Name", category.layer2Name())
            .addValue("layer3Id", category.layer3Id())
            .addValue("layer3Name", category.layer3Name())
            .addValue("listingOrder", listingOrder)
            .addValue("lastCrawledAt", toTimestamp(category.lastCrawledAt()));
        int updated = jdbc.update(
            """
                UPDATE categories
                SET layer1_id = :layer1Id,
                    layer1_name = :layer1Name,
                    layer2_id = :layer2Id,
                    layer2_name = :layer2Name,
                    layer3_name = :layer3Name,
                    listing_order = :listingOrder
                WHERE source = :source AND layer3_id = :layer3Id
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO categories (
                        source, layer1_id, layer1_name, layer2_id, layer2_name, layer3_id, layer3_name,
                        listing_order, last_crawled_at
                    )
                    VALUES (
                        :source, :layer1Id, :layer1Name, :layer2Id, :layer2Name, :layer3Id, :layer3Name,
                        :listingOrder, :lastCrawledAt
                    )
                    """,
                params
            );
        }
    }

    /**
     * Categories of one source in listing order, optionally narrowed to a single category.
     */
    public List<Category> findCategories(SourcePlatform source, String targetCategoryId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("source", source.code())
            .addValue("target", targetCategoryId);
        String filter = targetCategoryId == null || targetCategoryId.isBlank() ? "" : " AND layer3_id = :target";
        return jdbc.query(
            """
                SELECT source, layer1_id, layer1_name, layer2_id, layer2_name, layer3_id, layer3_name, last_crawled_at
                FROM categories
                WHERE source = :source
                """ + filter + " ORDER BY listing_order ASC, layer3_id ASC",
            params,
            categoryMapper(source)
        );
    }

    public Set<String> findCheckpointedCategoryIds(SourcePlatform source, Instant since) {
        List<String> ids = jdbc.query(
            """
                SELECT layer3_id
                FROM categories
                WHERE source = :source
                  AND last_crawled_at IS NOT NULL
                  AND last_crawled_at >= :since
                """,
            new MapSqlParameterSource()
                .addValue("source", source.code())
                .addValue("since", Timestamp.from(since)),
            (rs, rowNum) -> rs.getString("layer3_id")
        );
        return new HashSet<>(ids);
    }

    public int markCategoryCrawled(SourcePlatform source, String categoryId, Instant completedAt) {
        return jdbc.update(
            """
                UPDATE categories
                SET last_crawled_at = :completedAt
                WHERE source = :source AND layer3_id = :categoryId
                """,
            new MapSqlParameterSource()
                .addValue("source", source.code())
                .addValue("categoryId", categoryId)
                .addValue("completedAt", Timestamp.from(completedAt))
        );
    }

    public Optional<Instant> findCategoryCheckpoint(SourcePlatform source, String categoryId) {
        List<Timestamp> rows = jdbc.query(
            "SELECT last_crawled_at FROM categories WHERE source = :source AND layer3_id = :categoryId",
            new MapSqlParameterSource()
                .addValue("source", source.code())
                .addValue("categoryId", categoryId),
            (rs, rowNum) -> rs.getTimestamp("last_crawled_at")
        );
        if (rows.isEmpty() || rows.get(0) == null) {
            return Optional.empty();
        }
        return Optional.of(rows.get(0).toInstant());
    }

    // Posting records

    /**
     * Writes the organization, posting, native location and category link for one URL in a single
     * transaction. Returns {@code false} when any part of the write fails; nothing is committed then.
     */
    public boolean saveRecord(JobPosting posting, Organization organization, String categoryId, String categoryName, JobLocation location) {
        Objects.requireNonNull(posting, "posting");
        try {
            transactionTemplate.executeWithoutResult(status -> {
                Instant now = clock.instant();
                if (organization != null && organization.sourceId() != null) {
                    upsertOrganization(organization, now);
                }
                upsertPosting(posting, organization, categoryName, now);
                if (location != null) {
                    upsertLocation(posting.source(), posting.sourceId(), location, now);
                }
                if (categoryId != null && !categoryId.isBlank()) {
                    linkCategory(posting, categoryId, now);
                }
            });
            return true;
        } catch (DataAccessException e) {
            log.warn("Failed to persist posting source={} sourceId={} url={} error={}",
                posting.source().code(), posting.sourceId(), posting.url(), e.getMessage());
            return false;
        }
    }

    /**
     * Fills the organization row from its company page and marks it enriched. Fields the page did not carry
     * keep their stored values.
     *
     * @return {@code false} when no such organization row exists
     */
    public boolean updateOrganizationProfile(SourcePlatform source, String sourceId, CompanyProfile profile) {
        int updated = jdbc.update(
            """
                UPDATE organizations
                SET capital = COALESCE(:capital, capital),
                    employee_count = COALESCE(:employeeCount, employee_count),
                    description = COALESCE(:description, description),
                    address = COALESCE(:address, address),
                    website = COALESCE(:website, website),
                    data_source_layer = :layer,
                    updated_at = :now
                WHERE source = :source AND source_id = :sourceId
                """,
            new MapSqlParameterSource()
                .addValue("source", source.code())
                .addValue("sourceId", sourceId)
                .addValue("capital", profile.capital())
                .addValue("employeeCount", profile.employeeCount())
                .addValue("description", profile.description())
                .addValue("address", profile.address())
                .addValue("website", profile.website())
                .addValue("layer", Organization.LAYER_ENRICHED)
                .addValue("now", Timestamp.from(clock.instant()))
        );
        return updated > 0;
    }

    public Optional<CompanyProfile> findOrganizationProfile(SourcePlatform source, String sourceId) {
        List<CompanyProfile> rows = jdbc.query(
            """
                SELECT capital, employee_count, description, address, website
                FROM organizations
                WHERE source = :source AND source_id = :sourceId
                """,
            new MapSqlParameterSource()
                .addValue("source", source.code())
                .addValue("sourceId", sourceId),
            (rs, rowNum) -> new CompanyProfile(
                rs.getString("capital"),
                rs.getString("employee_count"),
                rs.getString("description"),
                rs.getString("address"),
                rs.getString("website")
            )
        );
        return rows.stream().findFirst();
    }

    public void saveJobLocation(SourcePlatform source, String jobSourceId, JobLocation location) {
        upsertLocation(source, jobSourceId, location, clock.instant());
    }

    public int saveJobSkills(SourcePlatform source, String jobSourceId, List<SkillTag> skills) {
        int written = 0;
        for (SkillTag skill : skills) {
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("source", source.code())
                .addValue("jobSourceId", jobSourceId)
                .addValue("skillName", skill.name())
                .addValue("skillType", skill.type())
                .addValue("confidence", skill.confidence());
            int updated = jdbc.update(
                """
                    UPDATE job_skills
                    SET skill_type = :skillType,
                        confidence = :confidence
                    WHERE source = :source AND job_source_id = :jobSourceId AND skill_name = :skillName
                    """,
                params
            );
            if (updated == 0) {
                jdbc.update(
                    """
                        INSERT INTO job_skills (source, job_source_id, skill_name, skill_type, confidence)
                        VALUES (:source, :jobSourceId, :skillName, :skillType, :confidence)
                        """,
                    params
                );
            }
            written++;
        }
        return written;
    }

    public Optional<JobPosting> findJobPosting(SourcePlatform source, String sourceId) {
        List<JobPosting> rows = jdbc.query(
            """
                SELECT source, source_id, url, title, organization_source_id, organization_name, description, address,
                       employment_type, salary_min, salary_max, salary_type, date_posted, data_source_layer, raw_json
                FROM job_postings
                WHERE source = :source AND source_id = :sourceId
                """,
            new MapSqlParameterSource()
                .addValue("source", source.code())
                .addValue("sourceId", sourceId),
            (rs, rowNum) -> {
                Date datePosted = rs.getDate("date_posted");
                long salaryMin = rs.getLong("salary_min");
                Long min = rs.wasNull() ? null : salaryMin;
                long salaryMax = rs.getLong("salary_max");
                Long max = rs.wasNull() ? null : salaryMax;
                return new JobPosting(
                    source,
                    rs.getString("source_id"),
                    rs.getString("url"),
                    rs.getString("title"),
                    rs.getString("organization_source_id"),
                    rs.getString("organization_name"),
                    rs.getString("description"),
                    rs.getString("address"),
                    rs.getString("employment_type"),
                    min,
                    max,
                    rs.getString("salary_type"),
                    datePosted == null ? null : datePosted.toLocalDate(),
                    rs.getString("data_source_layer"),
                    rs.getString("raw_json")
                );
            }
        );
        return rows.stream().findFirst();
    }

    public long countJobPostings(SourcePlatform source) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM job_postings WHERE source = :source",
            new MapSqlParameterSource("source", source.code()),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public Optional<JobLocation> findJobLocation(SourcePlatform source, String jobSourceId) {
        List<JobLocation> rows = jdbc.query(
            """
                SELECT latitude, longitude, formatted_address, provider
                FROM job_locations
                WHERE source = :source AND job_source_id = :jobSourceId
                """,
            new MapSqlParameterSource()
                .addValue("source", source.code())
                .addValue("jobSourceId", jobSourceId),
            (rs, rowNum) -> new JobLocation(
                rs.getDouble("latitude"),
                rs.getDouble("longitude"),
                rs.getString("formatted_address"),
                rs.getString("provider")
            )
        );
        return rows.stream().findFirst();
    }

    public List<SkillTag> findJobSkills(SourcePlatform source, String jobSourceId) {
        return jdbc.query(
            """
                SELECT skill_name, skill_type, confidence
                FROM job_skills
                WHERE source = :source AND job_source_id = :jobSourceId
                ORDER BY skill_name
                """,
            new MapSqlParameterSource()
                .addValue("source", source.code())
                .addValue("jobSourceId", jobSourceId),
            (rs, rowNum) -> new SkillTag(rs.getString("skill_name"), rs.getString("skill_type"), rs.getDouble("confidence"))
        );
    }

    public List<String> findCategoryJobIds(SourcePlatform source, String categoryId) {
        return jdbc.query(
            """
                SELECT job_source_id
                FROM category_jobs
                WHERE source = :source AND category_id = :categoryId
                ORDER BY job_source_id
                """,
            new MapSqlParameterSource()
                .addValue("source", source.code())
                .addValue("categoryId", categoryId),
            (rs, rowNum) -> rs.getString("job_source_id")
        );
    }

    // Platform health

    /**
     * Adds one observation to the source's health row. Latency is an exponentially weighted average.
     */
    public void recordPlatformHealth(SourcePlatform source, boolean fetchOk, boolean extractionOk, long latencyMs, String error) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("source", source.code())
            .addValue("success", fetchOk ? 1 : 0)
            .addValue("failed", fetchOk ? 0 : 1)
            .addValue("extractionSuccess", extractionOk ? 1 : 0)
            .addValue("extractionFailure", extractionOk ? 0 : 1)
            .addValue("latency", (double) Math.max(0L, latencyMs))
            .addValue("weight", LATENCY_SMOOTHING)
            .addValue("error", truncate(error, 1024))
            .addValue("now", Timestamp.from(clock.instant()));
        String update = """
            UPDATE platform_health
            SET total_requests = total_requests + 1,
                success_requests = success_requests + :success,
                failed_requests = failed_requests + :failed,
                extraction_success = extraction_success + :extractionSuccess,
                extraction_failure = extraction_failure + :extractionFailure,
                avg_latency_ms = CASE
                    WHEN total_requests = 0 THEN :latency
                    ELSE avg_latency_ms * (1 - :weight) + :latency * :weight
                END,
                last_error = COALESCE(:error, last_error),
                updated_at = :now
            WHERE source = :source
            """;
        if (jdbc.update(update, params) > 0) {
            return;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO platform_health (
                        source, total_requests, success_requests, failed_requests, extraction_success,
                        extraction_failure, avg_latency_ms, last_error, updated_at
                    )
                    VALUES (:source, 1, :success, :failed, :extractionSuccess, :extractionFailure, :latency, :error, :now)
                    """,
                params
            );
        } catch (DuplicateKeyException e) {
            jdbc.update(update, params);
        }
    }

    public List<PlatformHealth> listPlatformHealth() {
        return jdbc.query(
            """
                SELECT source, total_requests, success_requests, failed_requests, extraction_success,
                       extraction_failure, avg_latency_ms, last_error, updated_at
                FROM platform_health
                ORDER BY source
                """,
            platformHealthMapper()
        );
    }

    public Optional<PlatformHealth> findPlatformHealth(SourcePlatform source) {
        List<PlatformHealth> rows = jdbc.query(
            """
                SELECT source, total_requests, success_requests, failed_requests, extraction_success,
                       extraction_failure, avg_latency_ms, last_error, updated_at
                FROM platform_health
                WHERE source = :source
                """,
            new MapSqlParameterSource("source", source.code()),
            platformHealthMapper()
        );
        return rows.stream().findFirst();
    }

    private void upsertOrganization(Organization organization, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("source", organization.source().code())
            .addValue("sourceId", organization.sourceId())
            .addValue("name", organization.name())
            .addValue("companyUrl", organization.companyUrl())
            .addValue("address", organization.address())
            .addValue("description", organization.description())
            .addValue("layer", layerOrDefault(organization.dataSourceLayer()))
            .addValue("enrichedLayer", Organization.LAYER_ENRICHED)
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE organizations
                SET name = :name,
                    company_url = COALESCE(:companyUrl, company_url),
                    address = COALESCE(:address, address),
                    description = COALESCE(:description, description),
                    data_source_layer = CASE WHEN data_source_layer = :enrichedLayer THEN data_source_layer ELSE :layer END,
                    updated_at = :now
                WHERE source = :source AND source_id = :sourceId
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO organizations (source, source_id, name, company_url, address, description, data_source_layer, updated_at)
                    VALUES (:source, :sourceId, :name, :companyUrl, :address, :description, :layer, :now)
                    """,
                params
            );
        }
    }

    private void upsertPosting(JobPosting posting, Organization organization, String categoryName, Instant now) {
        String organizationSourceId = posting.organizationSourceId() != null
            ? posting.organizationSourceId()
            : organization == null ? null : organization.sourceId();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("source", posting.source().code())
            .addValue("sourceId", posting.sourceId())
            .addValue("url", posting.url())
            .addValue("title", posting.title())
            .addValue("organizationSourceId", organizationSourceId)
            .addValue("organizationName", posting.organizationName())
            .addValue("description", posting.description())
            .addValue("address", posting.address())
            .addValue("employmentType", posting.employmentType())
            .addValue("salaryMin", posting.salaryMin())
            .addValue("salaryMax", posting.salaryMax())
            .addValue("salaryType", posting.salaryType())
            .addValue("datePosted", posting.datePosted() == null ? null : Date.valueOf(posting.datePosted()))
            .addValue("categoryName", categoryName)
            .addValue("layer", layerOrDefault(posting.dataSourceLayer()))
            .addValue("contentHash", contentHash(posting))
            .addValue("rawJson", posting.rawJson())
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE job_postings
                SET url = :url,
                    title = :title,
                    organization_source_id = :organizationSourceId,
                    organization_name = :organizationName,
                    description = :description,
                    address = :address,
                    employment_type = :employmentType,
                    salary_min = :salaryMin,
                    salary_max = :salaryMax,
                    salary_type = :salaryType,
                    date_posted = :datePosted,
                    category_name = COALESCE(:categoryName, category_name),
                    data_source_layer = :layer,
                    content_hash = :contentHash,
                    raw_json = :rawJson,
                    last_seen_at = :now
                WHERE source = :source AND source_id = :sourceId
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO job_postings (
                        source, source_id, url, title, organization_source_id, organization_name, description,
                        address, employment_type, salary_min, salary_max, salary_type, date_posted, category_name,
                        data_source_layer, content_hash, raw_json, first_seen_at, last_seen_at
                    )
                    VALUES (
                        :source, :sourceId, :url, :title, :organizationSourceId, :organizationName, :description,
                        :address, :employmentType, :salaryMin, :salaryMax, :salaryType, :datePosted, :categoryName,
                        :layer, :contentHash, :rawJson, :now, :now
                    )
                    """,
                params
            );
        }
    }

    private void upsertLocation(SourcePlatform source, String jobSourceId, JobLocation location, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("source", source.code())
            .addValue("jobSourceId", jobSourceId)
            .addValue("latitude", location.latitude())
            .addValue("longitude", location.longitude())
            .addValue("formattedAddress", truncate(location.formattedAddress(), 512))
            .addValue("provider", location.provider())
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE job_locations
                SET latitude = :latitude,
                    longitude = :longitude,
                    formatted_address = :formattedAddress,
                    provider = :provider,
                    updated_at = :now
                WHERE source = :source AND job_source_id = :jobSourceId
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO job_locations (source, job_source_id, latitude, longitude, formatted_address, provider, updated_at)
                    VALUES (:source, :jobSourceId, :latitude, :longitude, :formattedAddress, :provider, :now)
                    """,
                params
            );
        }
    }

    private void linkCategory(JobPosting posting, String categoryId, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("source", posting.source().code())
            .addValue("categoryId", categoryId)
            .addValue("jobSourceId", posting.sourceId())
            .addValue("url", posting.url())
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE category_jobs
                SET job_url = :url,
                    linked_at = :now
                WHERE source = :source AND category_id = :categoryId AND job_source_id = :jobSourceId
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO category_jobs (source, category_id, job_source_id, job_url, linked_at)
                    VALUES (:source, :categoryId, :jobSourceId, :url, :now)
                    """,
                params
            );
        }
    }

    private RowMapper<Category> categoryMapper(SourcePlatform source) {
        return (rs, rowNum) -> {
            Timestamp crawled = rs.getTimestamp("last_crawled_at");
            return new Category(
                source,
                rs.getString("layer1_id"),
                rs.getString("layer1_name"),
                rs.getString("layer2_id"),
                rs.getString("layer2_name"),
                rs.getString("layer3_id"),
                rs.getString("layer3_name"),
                crawled == null ? null : crawled.toInstant()
            );
        };
    }

    private RowMapper<PlatformHealth> platformHealthMapper() {
        return (rs, rowNum) -> {
            Timestamp updatedAt = rs.getTimestamp("updated_at");
            return new PlatformHealth(
                rs.getString("source"),
                rs.getLong("total_requests"),
                rs.getLong("success_requests"),
                rs.getLong("failed_requests"),
                rs.getLong("extraction_success"),
                rs.getLong("extraction_failure"),
                rs.getDouble("avg_latency_ms"),
                rs.getString("last_error"),
                updatedAt == null ? null : updatedAt.toInstant()
            );
        };
    }

    private String contentHash(JobPosting posting) {
        return HashUtils.sha256Hex(String.join("|",
            Objects.toString(posting.title(), ""),
            Objects.toString(posting.organizationName(), ""),
            Objects.toString(posting.description(), ""),
            Objects.toString(posting.address(), ""),
            Objects.toString(posting.salaryMin(), ""),
            Objects.toString(posting.salaryMax(), "")
        ));
    }

    private static String layerOrDefault(String layer) {
        return layer == null || layer.isBlank() ? JobPosting.LAYER_NATIVE : layer;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
