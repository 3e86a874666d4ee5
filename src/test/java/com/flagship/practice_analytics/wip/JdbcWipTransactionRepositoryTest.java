package com.flagship.practice_analytics.wip;

import com.flagship.practice_analytics.scope.AnalyticsScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scope filtering and date windows of the WIP repository against a real PostgreSQL.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class JdbcWipTransactionRepositoryTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("practice_analytics_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private JdbcWipTransactionRepository repository;

    @Autowired
    private OpeningBalanceCalculator openingBalanceCalculator;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private String groupCode;
    private UUID clientA;
    private UUID clientB;
    private UUID taskA;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void insertClient(UUID clientId, String group) {
        jdbcTemplate.update(
            "INSERT INTO clients (gs_client_id, client_code, client_name, group_code, group_desc) VALUES (?, ?, ?, ?, ?)",
            clientId, "C-" + clientId.toString().substring(0, 8), "Client " + clientId, group, "Group " + group
        );
    }

    private void insertTask(UUID taskId, UUID clientId) {
        jdbcTemplate.update(
            "INSERT INTO tasks (gs_task_id, gs_client_id, task_code, task_desc) VALUES (?, ?, ?, ?)",
            taskId, clientId, "T-" + taskId.toString().substring(0, 8), "Task " + taskId
        );
    }

    private void insertWip(String date, String amount, String tType, String tranType, UUID clientId, UUID taskId) {
        jdbcTemplate.update(
            "INSERT INTO wip_transactions (tran_date, amount, t_type, tran_type, gs_client_id, gs_task_id, task_serv_line) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)",
            LocalDate.parse(date), new BigDecimal(amount), tType, tranType, clientId, taskId, "SL1"
        );
    }

    @BeforeEach
    void setUp() {
        groupCode = "G-" + UUID.randomUUID().toString().substring(0, 8);
        clientA = UUID.randomUUID();
        clientB = UUID.randomUUID();
        UUID clientC = UUID.randomUUID();
        taskA = UUID.randomUUID();
        UUID taskB = UUID.randomUUID();
        UUID taskC = UUID.randomUUID();

        insertClient(clientA, groupCode);
        insertClient(clientB, groupCode);
        insertClient(clientC, "OTHER-" + groupCode);
        insertTask(taskA, clientA);
        insertTask(taskB, clientB);
        insertTask(taskC, clientC);

        insertWip("2024-01-10", "100", "T", null, clientA, taskA);
        // Fee linked only through the task
        insertWip("2024-01-15", "40", "F", null, null, taskA);
        insertWip("2023-12-31", "70", "T", null, clientA, null);
        insertWip("2024-02-01", "25", "D", null, clientB, taskB);
        insertWip("2024-01-20", "999", "T", null, clientC, taskC);
        insertWip("2024-01-31", "-5", "ADJ", "TIME", clientA, taskA);
    }

    @Test
    @DisplayName("Client scope includes task-only rows and honours an inclusive window")
    void testClientWindow() {
        printTestHeader("Client Window");

        List<WipTransaction> rows = repository.findInWindow(
            AnalyticsScope.client(clientA), LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        printOutput("Rows", rows);
        assertEquals(3, rows.size());
        assertEquals(LocalDate.of(2024, 1, 10), rows.get(0).getDate());
        assertEquals(LocalDate.of(2024, 1, 15), rows.get(1).getDate());
        assertNull(rows.get(1).getClientId());
        assertEquals(taskA, rows.get(1).getTaskId());
        assertEquals(LocalDate.of(2024, 1, 31), rows.get(2).getDate());
        assertEquals("TIME", rows.get(2).getSubTypeCode());
        assertNotNull(rows.get(2).getUpdatedAt());
        printSuccess("Task-only fee row is part of the client scope");
    }

    @Test
    @DisplayName("Rows before the cutoff are returned for the opening balance")
    void testClientBefore() {
        List<WipTransaction> rows = repository.findBefore(AnalyticsScope.client(clientA), LocalDate.of(2024, 1, 1));

        assertEquals(1, rows.size());
        assertEquals(0, new BigDecimal("70").compareTo(rows.get(0).getAmount()));
    }

    @Test
    @DisplayName("Group scope covers every client of the group and nothing else")
    void testGroupScope() {
        List<WipTransaction> rows = repository.findInWindow(
            AnalyticsScope.group(groupCode), LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 29));

        assertEquals(4, rows.size());
        assertTrue(rows.stream().noneMatch(t -> t.getAmount().compareTo(new BigDecimal("999")) == 0));
    }

    @Test
    @DisplayName("Task scope returns the task's rows and type sums agree with them")
    void testTaskScopeAndTypeSums() {
        AnalyticsScope scope = AnalyticsScope.task(taskA);

        List<WipTransaction> all = repository.findAll(scope);
        List<TypeSum> sums = repository.sumByTypeBefore(scope, LocalDate.of(2024, 2, 1));

        assertEquals(3, all.size());
        assertEquals(3, sums.size());
        BigDecimal fromRows = openingBalanceCalculator.fromTransactions(all);
        BigDecimal fromSums = openingBalanceCalculator.fromTypeSums(sums);
        assertEquals(0, fromRows.compareTo(fromSums));
        assertEquals(0, new BigDecimal("55").compareTo(fromSums));
    }
}
