package com.flagship.pool_ledger.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pool_ledger.pool.Address;
import com.flagship.pool_ledger.pool.event.DepositedEvent;
import com.flagship.pool_ledger.pool.event.PoolEvent;
import com.flagship.pool_ledger.pool.event.WithdrawalRequestedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox persistence of pool events.
 *
 * These tests verify that:
 * - Events are stored in the order the engine emitted them, only inside a transaction
 * - Payloads are JSON with the participant address as the subject
 * - Publishing marks an event; failures count retries until dead-lettered
 * - Retention purges published events and never unpublished ones
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class OutboxServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("pool_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    private static final Address ALICE = Address.of("0x00000000000000000000000000000000000000c1");
    private static final Address BOB = Address.of("0x00000000000000000000000000000000000000c2");

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository repository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

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

    private static PoolEvent deposit(Address who, long amount) {
        return DepositedEvent.of(who, BigInteger.valueOf(amount), 6);
    }

    private void save(PoolEvent... events) {
        transactionTemplate.executeWithoutResult(status -> outboxService.saveEvents(List.of(events)));
    }

    @Test
    @DisplayName("Events are stored in emission order with increasing sequence numbers")
    void testSaveEvents_PreservesOrder() throws Exception {
        printTestHeader("Outbox Order");
        PoolEvent first = deposit(ALICE, 100);
        PoolEvent second = deposit(BOB, 200);

        save(first, second);
        List<OutboxEvent> stored = outboxService.findUnpublishedEvents(10, 5);
        printOutput("Stored", stored.size());

        assertEquals(2, stored.size());
        assertEquals(first.getEventId(), stored.get(0).getId());
        assertEquals(second.getEventId(), stored.get(1).getId());
        assertTrue(stored.get(0).getSequenceNumber() < stored.get(1).getSequenceNumber());

        OutboxEvent head = stored.get(0);
        assertEquals(ALICE.toString(), head.getSubject());
        assertEquals(DepositedEvent.EVENT_TYPE, head.getEventType());
        assertEquals(0, head.getRetryCount());
        assertEquals(ALICE.toString(), objectMapper.readTree(head.getPayload()).get("depositor").asText());
        assertEquals(100, objectMapper.readTree(head.getPayload()).get("amount").asLong());
        printSuccess("Order and payload preserved");
    }

    @Test
    @DisplayName("Saving outside a transaction is refused")
    void testSaveEvents_RequiresTransaction() {
        printTestHeader("Mandatory Transaction");

        assertThrows(IllegalTransactionStateException.class,
            () -> outboxService.saveEvents(List.of(deposit(ALICE, 1))));
        assertEquals(0, outboxService.countUnpublished());
        printSuccess("Events only written alongside pool state");
    }

    @Test
    @DisplayName("Rolled back transaction leaves no events")
    void testSaveEvents_RollbackLeavesNothing() {
        transactionTemplate.executeWithoutResult(status -> {
            outboxService.saveEvents(List.of(deposit(ALICE, 1)));
            status.setRollbackOnly();
        });

        assertEquals(0, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Published events are marked and no longer fetched")
    void testMarkPublished() {
        printTestHeader("Mark Published");
        PoolEvent event = deposit(ALICE, 100);
        save(event);

        outboxService.markPublished(event.getEventId());

        assertEquals(0, outboxService.countUnpublished());
        assertEquals(1, outboxService.getPublishedCount());
        assertTrue(outboxService.findUnpublishedEvents(10, 5).isEmpty());
        assertTrue(outboxService.findOldestUnpublishedCreatedAt().isEmpty());
        printSuccess("Event published");
    }

    @Test
    @DisplayName("Failures count retries and dead-lettered events are skipped")
    void testMarkFailed_DeadLetters() {
        printTestHeader("Retry Then Dead Letter");
        PoolEvent stuck = deposit(ALICE, 100);
        PoolEvent healthy = WithdrawalRequestedEvent.of(BOB, BigInteger.ZERO, BigInteger.TEN, 8);
        save(stuck, healthy);

        outboxService.markFailed(stuck.getEventId(), "broker down");
        Optional<OutboxEvent> failed = outboxService.markFailed(stuck.getEventId(), "broker down");
        printOutput("Retry count", failed.map(OutboxEvent::getRetryCount).orElse(-1));

        assertTrue(failed.isPresent());
        assertEquals(2, failed.get().getRetryCount());
        assertEquals("broker down", failed.get().getLastError());
        assertTrue(failed.get().isDeadLettered(2));

        List<OutboxEvent> publishable = outboxService.findUnpublishedEvents(10, 2);
        assertEquals(1, publishable.size());
        assertEquals(healthy.getEventId(), publishable.get(0).getId());
        assertEquals(1, outboxService.countDeadLettered(2));
        assertEquals(2, outboxService.countUnpublished());
        printSuccess("Dead letter kept but not retried");
    }

    @Test
    @DisplayName("Failure of an unknown event is a no-op")
    void testMarkFailed_Unknown() {
        assertTrue(outboxService.markFailed(DepositedEvent.of(ALICE, BigInteger.ONE, 1).getEventId(), "x").isEmpty());
    }

    @Test
    @DisplayName("Many unpublished events are all kept")
    void testSaveEvents_NeverDrops() {
        printTestHeader("Unbounded Outbox");
        for (int i = 1; i <= 50; i++) {
            save(deposit(ALICE, i));
        }
        printOutput("Unpublished", outboxService.countUnpublished());

        assertEquals(50, outboxService.countUnpublished());
        assertEquals(50, outboxService.findUnpublishedEvents(100, 5).size());
        printSuccess("Nothing dropped while unpublished");
    }

    @Test
    @DisplayName("Batch limit is honoured")
    void testFindUnpublished_Limit() {
        save(deposit(ALICE, 1), deposit(ALICE, 2), deposit(BOB, 3));

        assertEquals(2, outboxService.findUnpublishedEvents(2, 5).size());
    }

    @Test
    @DisplayName("Retention purges old published events and keeps unpublished ones")
    void testPurgePublished() {
        printTestHeader("Retention");
        PoolEvent old = deposit(ALICE, 1);
        PoolEvent waiting = deposit(BOB, 2);
        save(old, waiting);
        OutboxEventEntity published = repository.findById(old.getEventId()).orElseThrow();
        published.setPublishedAt(Instant.now().minus(Duration.ofDays(30)));
        repository.save(published);

        outboxService.purgePublished();

        assertTrue(repository.findById(old.getEventId()).isEmpty());
        assertTrue(repository.findById(waiting.getEventId()).isPresent());
        printSuccess("Only published events purged");
    }
}
