package com.flagship.practice_analytics.debtor;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Reads debtor transactions from the {@code drs_transactions} table.
 */
@Repository
public class JdbcDebtorTransactionRepository implements DebtorTransactionSource {

    private final JdbcTemplate jdbcTemplate;

    public JdbcDebtorTransactionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<DebtorTransaction> findByClient(UUID clientId) {
        return jdbcTemplate.query(
            "SELECT tran_date, total, entry_type, inv_number, serv_line_code, updated_at " +
            "FROM drs_transactions WHERE gs_client_id = ? ORDER BY tran_date, id",
            debtorTransactionRowMapper(),
            clientId
        );
    }

    private RowMapper<DebtorTransaction> debtorTransactionRowMapper() {
        return (rs, rowNum) -> {
            Timestamp updatedAt = rs.getTimestamp("updated_at");
            return DebtorTransaction.builder()
                .date(rs.getObject("tran_date", LocalDate.class))
                .amount(rs.getBigDecimal("total"))
                .entryType(rs.getString("entry_type"))
                .invoiceNumber(rs.getString("inv_number"))
                .serviceLineCode(rs.getString("serv_line_code"))
                .updatedAt(updatedAt != null ? updatedAt.toInstant() : null)
                .build();
        };
    }
}
