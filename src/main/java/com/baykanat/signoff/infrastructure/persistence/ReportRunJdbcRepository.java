package com.baykanat.signoff.infrastructure.persistence;

import com.baykanat.signoff.domain.engine.ComplianceReport;
import com.baykanat.signoff.domain.model.ReportRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** report_runs tablosu: koşu yaşam döngüsü (RUNNING → SUCCEEDED / FAILED) ve retention. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ReportRunJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_COLUMNS = """
            SELECT id, as_of, status, started_at, finished_at, history_rows, qualified_rows,
                   never_signoff_rows, risk_rows, dropped_rows, error_message
            FROM report_runs
            """;

    private static final RowMapper<ReportRun> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp finishedAt = rs.getTimestamp("finished_at");
        return ReportRun.builder()
                .id(rs.getLong("id"))
                .asOf(rs.getTimestamp("as_of").toLocalDateTime())
                .status(ReportRun.Status.valueOf(rs.getString("status")))
                .startedAt(rs.getTimestamp("started_at").toInstant())
                .finishedAt(finishedAt != null ? finishedAt.toInstant() : null)
                .historyRows(rs.getInt("history_rows"))
                .qualifiedRows(rs.getInt("qualified_rows"))
                .neverSignoffRows(rs.getInt("never_signoff_rows"))
                .riskRows(rs.getInt("risk_rows"))
                .droppedRows(rs.getInt("dropped_rows"))
                .errorMessage(rs.getString("error_message"))
                .build();
    };

    /** RUNNING durumunda yeni koşu açar; üretilen id'yi döner. */
    public long create(LocalDateTime asOf) {
        String sql = "INSERT INTO report_runs (as_of, status) VALUES (?, ?) RETURNING id";
        Long id = jdbcTemplate.queryForObject(sql, Long.class, Timestamp.valueOf(asOf), ReportRun.Status.RUNNING.name());
        return Objects.requireNonNull(id, "generated report run id");
    }

    public void markSucceeded(long runId, ComplianceReport report) {
        String sql = """
                UPDATE report_runs
                SET status = ?, finished_at = NOW(), history_rows = ?, qualified_rows = ?,
                    never_signoff_rows = ?, risk_rows = ?, dropped_rows = ?
                WHERE id = ?
                """;
        jdbcTemplate.update(sql, ReportRun.Status.SUCCEEDED.name(),
                report.getHistory().getRows().size(),
                report.getQualified().getRows().size(),
                report.getNeverSignoff().getRows().size(),
                report.getRisk().getRows().size(),
                report.totalDropped(),
                runId);
    }

    public void markFailed(long runId, String errorMessage) {
        String sql = "UPDATE report_runs SET status = ?, finished_at = NOW(), error_message = ? WHERE id = ?";
        jdbcTemplate.update(sql, ReportRun.Status.FAILED.name(), errorMessage, runId);
    }

    public Optional<ReportRun> findById(long runId) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", ROW_MAPPER, runId)
                .stream()
                .findFirst();
    }

    /** Sorgular için varsayılan koşu: en son başlatılmış başarılı koşu. */
    public Optional<ReportRun> findLatestSucceeded() {
        String sql = SELECT_COLUMNS + " WHERE status = ? ORDER BY id DESC LIMIT 1";
        return jdbcTemplate.query(sql, ROW_MAPPER, ReportRun.Status.SUCCEEDED.name())
                .stream()
                .findFirst();
    }

    public List<ReportRun> findRecent(int limit) {
        return jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY id DESC LIMIT ?", ROW_MAPPER, limit);
    }

    /**
     * retentionDays günden önce bitmiş koşuları siler; sonuç satırları cascade ile gider.
     * En son başarılı koşu her zaman korunur.
     */
    public int deleteFinishedOlderThan(int retentionDays) {
        String sql = """
                DELETE FROM report_runs
                WHERE status <> 'RUNNING'
                  AND finished_at < NOW() - INTERVAL '1 day' * ?
                  AND id <> COALESCE((SELECT MAX(id) FROM report_runs WHERE status = 'SUCCEEDED'), -1)
                """;
        return jdbcTemplate.update(sql, retentionDays);
    }
}
