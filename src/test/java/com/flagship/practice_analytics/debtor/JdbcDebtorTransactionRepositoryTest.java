package com.flagship.practice_analytics.debtor;

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

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class JdbcDebtorTransactionRepositoryTest {

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
    private JdbcDebtorTransactionRepository repository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private void insertDebtor(UUID clientId, String date, String total, String entryType, String invoice) {
        jdbcTemplate.update(
            "INSERT INTO drs_transactions (tran_date, total, entry_type, inv_number, serv_line_code, gs_client_id) " +
            "VALUES (?, ?, ?, ?, ?, ?)",
            LocalDate.parse(date), total == null ? null : new BigDecimal(total), entryType, invoice, "SL1", clientId
        );
    }

    @Test
    @DisplayName("Client debtor rows are returned in date order with all columns mapped")
    void testFindByClient() {
        UUID clientId = UUID.randomUUID();
        UUID otherClient = UUID.randomUUID();
        insertDebtor(clientId, "2024-03-10", "-500.00", "Receipt", "INV-1");
        insertDebtor(clientId, "2024-02-01", "500.00", "Invoice", "INV-1");
        insertDebtor(clientId, "2024-03-10", null, "Journal", null);
        insertDebtor(otherClient, "2024-01-01", "75.00", "Invoice", "INV-2");

        List<DebtorTransaction> rows = repository.findByClient(clientId);

        assertEquals(3, rows.size());
        DebtorTransaction invoice = rows.get(0);
        assertEquals(LocalDate.of(2024, 2, 1), invoice.getDate());
        assertEquals(new BigDecimal("500.00"), invoice.getAmount());
        assertTrue(invoice.isInvoice());
        assertEquals("INV-1", invoice.getInvoiceNumber());
        assertEquals("SL1", invoice.getServiceLineCode());
        assertNotNull(invoice.getUpdatedAt());

        assertTrue(rows.get(1).isPayment());
        assertNull(rows.get(2).getAmount());
        assertEquals(BigDecimal.ZERO, rows.get(2).amountOrZero());
    }

    @Test
    @DisplayName("A client without debtor rows gets an empty list")
    void testNoRows() {
        assertTrue(repository.findByClient(UUID.randomUUID()).isEmpty());
    }
}
