package com.visualsearch.crawler.crawl.persistence;

import com.visualsearch.crawler.crawl.model.CrawlJob;
import com.visualsearch.crawler.crawl.model.CrawlJobStats;
import com.visualsearch.crawler.crawl.model.CrawlJobStatus;
import com.visualsearch.crawler.crawl.model.CrawlJobView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job rows. Every status or lease change is a single guarded UPDATE that also bumps
 * {@code version}, so two writers can never both win against the same row state.
 */
@Repository
public class CrawlJobRepository {
    private static final Logger log = LoggerFactory.getLogger(CrawlJobRepository.class);
    private static final int CLAIM_CANDIDATES = 5;

    private static final String JOB_COLUMNS = """
        j.id, j.provider_id, j.start_url, j.sitemap_url, j.max_pages, j.status, j.created_at, j.started_at,
        j.paused_at, j.canceled_at, j.completed_at, j.lease_owner, j.lease_expires_at, j.error_message, j.version
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public CrawlJobRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertJob(long providerId, String startUrl, String sitemapUrl, Integer maxPages, Instant createdAt) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO crawl_jobs (provider_id, start_url, sitemap_url, max_pages, status, created_at, version)
                VALUES (:providerId, :startUrl, :sitemapUrl, :maxPages, 'QUEUED', :createdAt, 0)
                """,
            new MapSqlParameterSource()
                .addValue("providerId", providerId)
                .addValue("startUrl", startUrl)
                .addValue("sitemapUrl", sitemapUrl)
                .addValue("maxPages", maxPages)
                .addValue("createdAt", Timestamp.from(createdAt)),
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert crawl job");
        }
        return key.longValue();
    }

    public Optional<CrawlJob> findById(long jobId) {
        List<CrawlJob> rows = jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM crawl_jobs j WHERE j.id = :id",
            Map.of("id", jobId),
            this::mapJob
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Claims the oldest Queued job, or a Running job whose lease has lapsed. Candidates are read
     * with their version and each is taken with a compare-and-swap; a lost race moves on to the
     * next candidate.
     */
    public Optional<CrawlJob> claimNext(String workerId, Instant now, Instant leaseExpiresAt) {
        MapSqlParameterSource candidateParams = new MapSqlParameterSource()
            .addValue("now", Timestamp.from(now))
            .addValue("limit", CLAIM_CANDIDATES);
        while (true) {
            List<long[]> candidates = jdbc.query(
                """
                    SELECT id, version
                    FROM crawl_jobs
                    WHERE status = 'QUEUED'
                       OR (status = 'RUNNING' AND lease_expires_at < :now)
                    ORDER BY created_at ASC, id ASC
                    LIMIT :limit
                    """,
                candidateParams,
                (rs, rowNum) -> new long[] {rs.getLong("id"), rs.getLong("version")}
            );
            if (candidates.isEmpty()) {
                return Optional.empty();
            }
            for (long[] candidate : candidates) {
                int updated;
                try {
                    updated = jdbc.update(
                        """
                            UPDATE crawl_jobs
                            SET status = 'RUNNING',
                                lease_owner = :workerId,
                                lease_expires_at = :leaseExpiresAt,
                                started_at = COALESCE(started_at, :now),
                                version = version + 1
                            WHERE id = :id
                              AND version = :version
                              AND (status = 'QUEUED' OR (status = 'RUNNING' AND lease_expires_at < :now))
                            """,
                        new MapSqlParameterSource()
                            .addValue("workerId", workerId)
                            .addValue("leaseExpiresAt", Timestamp.from(leaseExpiresAt))
                            .addValue("now", Timestamp.from(now))
                            .addValue("id", candidate[0])
                            .addValue("version", candidate[1])
                    );
                } catch (ConcurrencyFailureException e) {
                    log.debug("Lost claim race on job {}: {}", candidate[0], e.getMessage());
                    continue;
                }
                if (updated == 1) {
                    return findById(candidate[0]);
                }
            }
            // every candidate was taken by someone else; look again
        }
    }

    public boolean renewLease(long jobId, String workerId, Instant leaseExpiresAt) {
        int updated = jdbc.update(
            """
                UPDATE crawl_jobs
                SET lease_expires_at = :leaseExpiresAt,
                    version = version + 1
                WHERE id = :id
                  AND status = 'RUNNING'
                  AND lease_owner = :workerId
                """,
            new MapSqlParameterSource()
                .addValue("leaseExpiresAt", Timestamp.from(leaseExpiresAt))
                .addValue("id", jobId)
                .addValue("workerId", workerId)
        );
        return updated == 1;
    }

    /**
     * Moves a Running job held by {@code workerId} to a terminal status and clears its lease.
     */
    public boolean completeLeased(long jobId, String workerId, CrawlJobStatus status, String errorMessage, Instant now) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        int updated = jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = :status,
                    completed_at = :now,
                    error_message = :errorMessage,
                    lease_owner = NULL,
                    lease_expires_at = NULL,
                    version = version + 1
                WHERE id = :id
                  AND status = 'RUNNING'
                  AND lease_owner = :workerId
                """,
            new MapSqlParameterSource()
                .addValue("status", status.name())
                .addValue("now", Timestamp.from(now))
                .addValue("errorMessage", errorMessage)
                .addValue("id", jobId)
                .addValue("workerId", workerId)
        );
        return updated == 1;
    }

    public boolean markCanceled(long jobId, Instant now) {
        return jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = 'CANCELED',
                    canceled_at = :now,
                    completed_at = :now,
                    lease_owner = NULL,
                    lease_expires_at = NULL,
                    version = version + 1
                WHERE id = :id
                  AND status IN ('QUEUED', 'RUNNING')
                """,
            new MapSqlParameterSource()
                .addValue("id", jobId)
                .addValue("now", Timestamp.from(now))
        ) == 1;
    }

    public boolean markPaused(long jobId, Instant now) {
        return jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = 'PAUSED',
                    paused_at = :now,
                    lease_owner = NULL,
                    lease_expires_at = NULL,
                    version = version + 1
                WHERE id = :id
                  AND status = 'RUNNING'
                """,
            new MapSqlParameterSource()
                .addValue("id", jobId)
                .addValue("now", Timestamp.from(now))
        ) == 1;
    }

    public boolean markResumed(long jobId) {
        return jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = 'QUEUED',
                    paused_at = NULL,
                    version = version + 1
                WHERE id = :id
                  AND status = 'PAUSED'
                """,
            Map.of("id", jobId)
        ) == 1;
    }

    /**
     * Deletes a job that is not Queued or Running. Pages go with it; extracted products stay.
     */
    public boolean deleteInactive(long jobId) {
        return jdbc.update(
            "DELETE FROM crawl_jobs WHERE id = :id AND status NOT IN ('QUEUED', 'RUNNING')",
            Map.of("id", jobId)
        ) == 1;
    }

    public Optional<CrawlJobView> findView(long jobId) {
        List<CrawlJobView> rows = jdbc.query(
            viewSelect() + " WHERE j.id = :id",
            Map.of("id", jobId),
            this::mapView
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<CrawlJobView> listViews(CrawlJobStatus status, Long providerId, int limit, int offset) {
        MapSqlParameterSource params = filterParams(status, providerId)
            .addValue("limit", limit)
            .addValue("offset", offset);
        return jdbc.query(
            viewSelect() + filterClause(status, providerId) + " ORDER BY j.created_at DESC, j.id DESC LIMIT :limit OFFSET :offset",
            params,
            this::mapView
        );
    }

    public long countJobs(CrawlJobStatus status, Long providerId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM crawl_jobs j" + filterClause(status, providerId),
            filterParams(status, providerId),
            Long.class
        );
        return count == null ? 0 : count;
    }

    public CrawlJobStats fetchStats() {
        Map<String, Long> counts = new HashMap<>();
        jdbc.query(
            "SELECT status, COUNT(*) AS cnt FROM crawl_jobs GROUP BY status",
            Map.of(),
            rs -> {
                counts.put(rs.getString("status"), rs.getLong("cnt"));
            }
        );
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        return new CrawlJobStats(
            total,
            counts.getOrDefault(CrawlJobStatus.QUEUED.name(), 0L),
            counts.getOrDefault(CrawlJobStatus.RUNNING.name(), 0L),
            counts.getOrDefault(CrawlJobStatus.PAUSED.name(), 0L),
            counts.getOrDefault(CrawlJobStatus.SUCCEEDED.name(), 0L),
            counts.getOrDefault(CrawlJobStatus.FAILED.name(), 0L),
            counts.getOrDefault(CrawlJobStatus.CANCELED.name(), 0L)
        );
    }

    private String viewSelect() {
        return """
            SELECT j.id, j.provider_id, p.name AS provider_name, j.start_url, j.sitemap_url, j.max_pages, j.status,
                   j.created_at, j.started_at, j.paused_at, j.canceled_at, j.completed_at, j.lease_owner,
                   j.lease_expires_at, j.error_message,
                   (SELECT COUNT(*) FROM crawl_pages cp WHERE cp.crawl_job_id = j.id) AS pages_total,
                   (SELECT COUNT(*) FROM crawl_pages cp WHERE cp.crawl_job_id = j.id AND cp.status = 'SUCCEEDED') AS pages_succeeded,
                   (SELECT COUNT(*) FROM crawl_pages cp WHERE cp.crawl_job_id = j.id AND cp.status = 'FAILED') AS pages_failed,
                   (SELECT COUNT(*) FROM extracted_products ep WHERE ep.crawl_job_id = j.id) AS products_extracted
            FROM crawl_jobs j
            LEFT JOIN providers p ON p.id = j.provider_id
            """;
    }

    private String filterClause(CrawlJobStatus status, Long providerId) {
        StringBuilder clause = new StringBuilder(" WHERE 1 = 1");
        if (status != null) {
            clause.append(" AND j.status = :status");
        }
        if (providerId != null) {
            clause.append(" AND j.provider_id = :providerId");
        }
        return clause.toString();
    }

    private MapSqlParameterSource filterParams(CrawlJobStatus status, Long providerId) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (status != null) {
            params.addValue("status", status.name());
        }
        if (providerId != null) {
            params.addValue("providerId", providerId);
        }
        return params;
    }

    private CrawlJob mapJob(ResultSet rs, int rowNum) throws SQLException {
        return new CrawlJob(
            rs.getLong("id"),
            rs.getLong("provider_id"),
            rs.getString("start_url"),
            rs.getString("sitemap_url"),
            nullableInt(rs, "max_pages"),
            CrawlJobStatus.fromValue(rs.getString("status")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("paused_at")),
            toInstant(rs.getTimestamp("canceled_at")),
            toInstant(rs.getTimestamp("completed_at")),
            rs.getString("lease_owner"),
            toInstant(rs.getTimestamp("lease_expires_at")),
            rs.getString("error_message"),
            rs.getLong("version")
        );
    }

    private CrawlJobView mapView(ResultSet rs, int rowNum) throws SQLException {
        return new CrawlJobView(
            rs.getLong("id"),
            rs.getLong("provider_id"),
            rs.getString("provider_name"),
            rs.getString("start_url"),
            rs.getString("sitemap_url"),
            nullableInt(rs, "max_pages"),
            CrawlJobStatus.fromValue(rs.getString("status")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("paused_at")),
            toInstant(rs.getTimestamp("canceled_at")),
            toInstant(rs.getTimestamp("completed_at")),
            rs.getString("lease_owner"),
            toInstant(rs.getTimestamp("lease_expires_at")),
            rs.getString("error_message"),
            rs.getInt("pages_total"),
            rs.getInt("pages_succeeded"),
            rs.getInt("pages_failed"),
            rs.getInt("products_extracted")
        );
    }

    static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
