package com.flagship.practice_analytics.serviceline;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Repository
public class JdbcServiceLineRepository implements ServiceLineRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcServiceLineRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Map<String, String> findExternalToMasterMappings() {
        List<String[]> rows = jdbcTemplate.query(
            "SELECT serv_line_code, master_code FROM service_line_external WHERE master_code IS NOT NULL",
            (rs, rowNum) -> new String[] {rs.getString("serv_line_code"), rs.getString("master_code")}
        );

        Map<String, String> mappings = new HashMap<>();
        for (String[] row : rows) {
            mappings.put(row[0], row[1]);
        }
        return mappings;
    }

    @Override
    public List<MasterServiceLine> findMasterServiceLines(Collection<String> codes) {
        List<String> knownCodes = codes.stream()
            .filter(code -> !ServiceLinePartitioner.UNKNOWN.equals(code))
            .toList();
        if (knownCodes.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.query(
            "SELECT code, name FROM service_line_master WHERE code IN (:codes) ORDER BY sort_order, code",
            new MapSqlParameterSource("codes", knownCodes),
            (rs, rowNum) -> new MasterServiceLine(rs.getString("code"), rs.getString("name"))
        );
    }
}
