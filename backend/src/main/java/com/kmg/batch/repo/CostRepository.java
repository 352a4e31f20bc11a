package com.kmg.batch.repo;

import com.kmg.batch.model.CostRecord;
import com.kmg.batch.model.CostSummary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;

@Repository
public class CostRepository {
    private final JdbcTemplate jdbcTemplate;

    public CostRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<CostRecord> MAPPER = new RowMapper<>() {
        @Override
        public CostRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new CostRecord(
                    rs.getLong("id"),
                    rs.getString("job_name"),
                    rs.getString("batch_id"),
                    rs.getString("model"),
                    rs.getInt("num_requests"),
                    rs.getInt("completed_requests"),
                    rs.getLong("input_tokens"),
                    rs.getLong("output_tokens"),
                    rs.getDouble("regular_cost"),
                    rs.getDouble("batch_cost"),
                    rs.getDouble("savings"),
                    SqlTime.parse(rs.getString("recorded_at"))
            );
        }
    };

    public void initializeSchema() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS job_costs (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              job_name TEXT NOT NULL,
              batch_id TEXT,
              model TEXT NOT NULL,
              num_requests INTEGER NOT NULL,
              completed_requests INTEGER NOT NULL DEFAULT 0,
              input_tokens INTEGER NOT NULL,
              output_tokens INTEGER NOT NULL,
              regular_cost REAL NOT NULL,
              batch_cost REAL NOT NULL,
              savings REAL NOT NULL,
              recorded_at TEXT NOT NULL
            )
            """);
    }

    public void insert(CostRecord record) {
        jdbcTemplate.update(
                """
                INSERT INTO job_costs(job_name, batch_id, model, num_requests, completed_requests,
                                      input_tokens, output_tokens, regular_cost, batch_cost, savings, recorded_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                record.jobName(),
                record.batchId(),
                record.model(),
                record.numRequests(),
                record.completedRequests(),
                record.inputTokens(),
                record.outputTokens(),
                record.regularCost(),
                record.batchCost(),
                record.savings(),
                SqlTime.toText(record.recordedAt() == null ? OffsetDateTime.now() : record.recordedAt())
        );
    }

    public List<CostRecord> findAll() {
        return jdbcTemplate.query("SELECT * FROM job_costs ORDER BY id ASC", MAPPER);
    }

    public CostSummary summarize() {
        return jdbcTemplate.queryForObject(
                """
                SELECT COUNT(*) AS total_jobs,
                       COALESCE(SUM(CASE WHEN completed_requests > 0 THEN 1 ELSE 0 END), 0) AS completed_jobs,
                       COALESCE(SUM(CASE WHEN completed_requests > 0 THEN completed_requests ELSE num_requests END), 0)
                           AS total_requests,
                       COALESCE(SUM(batch_cost), 0) AS total_cost,
                       COALESCE(SUM(input_tokens), 0) AS total_input_tokens,
                       COALESCE(SUM(output_tokens), 0) AS total_output_tokens,
                       COALESCE(SUM(savings), 0) AS total_savings
                  FROM job_costs
                """,
                (rs, rowNum) -> new CostSummary(
                        rs.getInt("total_jobs"),
                        rs.getInt("completed_jobs"),
                        rs.getLong("total_requests"),
                        rs.getDouble("total_cost"),
                        rs.getLong("total_input_tokens"),
                        rs.getLong("total_output_tokens"),
                        rs.getDouble("total_savings")
                )
        );
    }
}
