package com.flagship.practice_analytics.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Health of the ledger read model the analytics are computed from.
 *
 * DOWN when the tables cannot be queried. When UP, the newest WIP and debtor
 * transaction dates are reported so a stalled import is visible before
 * anyone notices flat graphs.
 */
@Component("readModel")
@Slf4j
public class ReadModelHealthIndicator implements HealthIndicator {

    static final String LATEST_WIP_SQL = "SELECT MAX(tran_date) FROM wip_transactions";
    static final String LATEST_DEBTOR_SQL = "SELECT MAX(tran_date) FROM drs_transactions";

    private final JdbcTemplate jdbcTemplate;

    public ReadModelHealthIndicator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Health health() {
        try {
            LocalDate latestWip = jdbcTemplate.queryForObject(LATEST_WIP_SQL, LocalDate.class);
            LocalDate latestDebtor = jdbcTemplate.queryForObject(LATEST_DEBTOR_SQL, LocalDate.class);

            return Health.up()
                    .withDetail("latestWipTransaction", latestWip != null ? latestWip.toString() : "none")
                    .withDetail("latestDebtorTransaction", latestDebtor != null ? latestDebtor.toString() : "none")
                    .build();

        } catch (DataAccessException e) {
            log.warn("Read model health check failed: {}", e.getMessage());
            return Health.down()
                    .withDetail("error", e.getMostSpecificCause().getMessage() != null
                            ? e.getMostSpecificCause().getMessage()
                            : e.getClass().getSimpleName())
                    .build();
        }
    }
}
