package com.herzen.audit.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Repository
public class AuditRunJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public AuditRunJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void saveRuns(List<AuditRunRow> rows) {
        rows.forEach(r -> jdbcTemplate.update(
                "INSERT INTO audit_runs(run_id, student_id, block_id, satisfied, applied_credits, shortfalls, ts) VALUES (?,?,?,?,?,?,?)",
                r.runId(), r.studentId(), r.blockId(), r.satisfied(), r.appliedCredits(), r.shortfalls(), r.ts().toString()));
    }

    public List<AuditRunRow> loadRuns(String studentId) {
        return jdbcTemplate.query(
                "SELECT run_id, student_id, block_id, satisfied, applied_credits, shortfalls, ts FROM audit_runs WHERE student_id=? ORDER BY id",
                (rs, n) -> new AuditRunRow(rs.getString(1), rs.getString(2), rs.getString(3), rs.getBoolean(4),
                        rs.getBigDecimal(5), rs.getInt(6), Instant.parse(rs.getString(7))),
                studentId);
    }

    public record AuditRunRow(String runId,
                              String studentId,
                              String blockId,
                              boolean satisfied,
                              BigDecimal appliedCredits,
                              int shortfalls,
                              Instant ts) {}
}
