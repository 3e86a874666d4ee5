package com.flagship.practice_analytics.wip;

import com.flagship.practice_analytics.scope.AnalyticsScope;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Reads WIP transactions from the {@code wip_transactions} table.
 *
 * Client and group scopes match rows linked to the client(s) OR to any of their
 * tasks. Billing fees are often linked only via the task (NULL gs_client_id), so a
 * client-only filter would understate billing.
 */
@Repository
public class JdbcWipTransactionRepository implements WipTransactionSource {

    private static final String SELECT_COLUMNS =
        "SELECT w.tran_date, w.amount, w.t_type, w.tran_type, w.gs_client_id, w.gs_task_id, " +
        "w.task_serv_line, w.updated_at FROM wip_transactions w WHERE ";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcWipTransactionRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<WipTransaction> findInWindow(AnalyticsScope scope, LocalDate from, LocalDate to) {
        MapSqlParameterSource params = scopeParams(scope)
            .addValue("fromDate", from)
            .addValue("toDate", to);
        return jdbcTemplate.query(
            SELECT_COLUMNS + scopeCondition(scope) +
            " AND w.tran_date >= :fromDate AND w.tran_date <= :toDate ORDER BY w.tran_date",
            params,
            wipTransactionRowMapper()
        );
    }

    @Override
    public List<WipTransaction> findBefore(AnalyticsScope scope, LocalDate cutoff) {
        MapSqlParameterSource params = scopeParams(scope).addValue("cutoff", cutoff);
        return jdbcTemplate.query(
            SELECT_COLUMNS + scopeCondition(scope) + " AND w.tran_date < :cutoff",
            params,
            wipTransactionRowMapper()
        );
    }

    @Override
    public List<TypeSum> sumByTypeBefore(AnalyticsScope scope, LocalDate cutoff) {
        MapSqlParameterSource params = scopeParams(scope).addValue("cutoff", cutoff);
        return jdbcTemplate.query(
            "SELECT w.t_type, w.tran_type, COALESCE(SUM(w.amount), 0) AS total " +
            "FROM wip_transactions w WHERE " + scopeCondition(scope) +
            " AND w.tran_date < :cutoff GROUP BY w.t_type, w.tran_type",
            params,
            (rs, rowNum) -> new TypeSum(
                rs.getString("t_type"),
                rs.getString("tran_type"),
                rs.getBigDecimal("total")
            )
        );
    }

    @Override
    public List<WipTransaction> findAll(AnalyticsScope scope) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + scopeCondition(scope),
            scopeParams(scope),
            wipTransactionRowMapper()
        );
    }

    private String scopeCondition(AnalyticsScope scope) {
        return switch (scope.getType()) {
            case CLIENT -> "(w.gs_client_id = :scopeId OR w.gs_task_id IN " +
                "(SELECT t.gs_task_id FROM tasks t WHERE t.gs_client_id = :scopeId))";
            case GROUP -> "(w.gs_client_id IN (SELECT c.gs_client_id FROM clients c WHERE c.group_code = :scopeId) " +
                "OR w.gs_task_id IN (SELECT t.gs_task_id FROM tasks t " +
                "JOIN clients c ON c.gs_client_id = t.gs_client_id WHERE c.group_code = :scopeId))";
            case TASK -> "w.gs_task_id = :scopeId";
        };
    }

    private MapSqlParameterSource scopeParams(AnalyticsScope scope) {
        Object scopeId = switch (scope.getType()) {
            case CLIENT, TASK -> scope.uuid();
            case GROUP -> scope.getIdentifier();
        };
        return new MapSqlParameterSource("scopeId", scopeId);
    }

    private RowMapper<WipTransaction> wipTransactionRowMapper() {
        return (rs, rowNum) -> {
            Timestamp updatedAt = rs.getTimestamp("updated_at");
            return WipTransaction.builder()
                .date(rs.getObject("tran_date", LocalDate.class))
                .amount(rs.getBigDecimal("amount"))
                .typeCode(rs.getString("t_type"))
                .subTypeCode(rs.getString("tran_type"))
                .clientId(rs.getObject("gs_client_id", UUID.class))
                .taskId(rs.getObject("gs_task_id", UUID.class))
                .serviceLineCode(rs.getString("task_serv_line"))
                .updatedAt(updatedAt != null ? updatedAt.toInstant() : null)
                .build();
        };
    }
}
