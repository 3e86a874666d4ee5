package com.flagship.practice_analytics.scope;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC lookups of clients, groups and tasks.
 */
@Repository
public class JdbcScopeRepository implements ScopeRepository {

    private final JdbcTemplate jdbcTemplate;

    public JdbcScopeRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<ClientInfo> findClient(UUID clientId) {
        List<ClientInfo> clients = jdbcTemplate.query(
            "SELECT gs_client_id, client_code, client_name, group_code FROM clients WHERE gs_client_id = ?",
            (rs, rowNum) -> new ClientInfo(
                rs.getObject("gs_client_id", UUID.class),
                rs.getString("client_code"),
                rs.getString("client_name"),
                rs.getString("group_code")
            ),
            clientId
        );
        return clients.stream().findFirst();
    }

    @Override
    public Optional<GroupInfo> findGroup(String groupCode) {
        Integer clientCount = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM clients WHERE group_code = ?",
            Integer.class,
            groupCode
        );
        if (clientCount == null || clientCount == 0) {
            return Optional.empty();
        }

        String groupDesc = jdbcTemplate.queryForObject(
            "SELECT MAX(group_desc) FROM clients WHERE group_code = ?",
            String.class,
            groupCode
        );
        return Optional.of(new GroupInfo(groupCode, groupDesc, clientCount));
    }

    @Override
    public Optional<TaskInfo> findTask(UUID taskId) {
        List<TaskInfo> tasks = jdbcTemplate.query(
            "SELECT gs_task_id, task_code, task_desc, gs_client_id FROM tasks WHERE gs_task_id = ?",
            (rs, rowNum) -> new TaskInfo(
                rs.getObject("gs_task_id", UUID.class),
                rs.getString("task_code"),
                rs.getString("task_desc"),
                rs.getObject("gs_client_id", UUID.class)
            ),
            taskId
        );
        return tasks.stream().findFirst();
    }
}
