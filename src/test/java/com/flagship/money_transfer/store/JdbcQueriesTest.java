package com.flagship.money_transfer.store;

import com.flagship.money_transfer.exception.AccountNotFoundException;
import com.flagship.money_transfer.ledger.Account;
import com.flagship.money_transfer.ledger.CurrencyCode;
import com.flagship.money_transfer.ledger.Entry;
import com.flagship.money_transfer.ledger.Transfer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Single-statement queries outside of any transaction.
 */
@SpringBootTest
@Testcontainers
class JdbcQueriesTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("money_transfer_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private JdbcQueries queries;

    private Account account1;
    private Account account2;

    @BeforeEach
    void setUp() {
        account1 = queries.createAccount("owner-1", 500, CurrencyCode.USD);
        account2 = queries.createAccount("owner-2", 0, CurrencyCode.USD);
    }

    @Test
    @DisplayName("Created account can be read back")
    void testCreateAndGetAccount() {
        Account account = queries.createAccount("carol", 1234, CurrencyCode.GBP);

        assertTrue(account.getId() > 0);
        assertEquals("carol", account.getOwner());
        assertEquals(1234, account.getBalance());
        assertEquals(CurrencyCode.GBP, account.getCurrency());
        assertNotNull(account.getCreatedAt());
        assertEquals(account, queries.getAccount(account.getId()));
    }

    @Test
    @DisplayName("Unknown account id is reported as not found")
    void testGetMissingAccount() {
        assertThrows(AccountNotFoundException.class, () -> queries.getAccount(-1L));
        assertThrows(AccountNotFoundException.class, () -> queries.getAccountForUpdate(-1L));
        assertThrows(AccountNotFoundException.class, () -> queries.updateAccount(-1L, 10));
    }

    @Test
    @DisplayName("Update overwrites the balance and returns the new state")
    void testUpdateAccount() {
        Account updated = queries.updateAccount(account1.getId(), -25);

        assertEquals(-25, updated.getBalance());
        assertEquals(account1.getOwner(), updated.getOwner());
        assertEquals(-25, queries.getAccountForUpdate(account1.getId()).getBalance());
    }

    @Test
    @DisplayName("Entries are listed per account in insertion order")
    void testCreateAndListEntries() {
        Entry first = queries.createEntry(account1.getId(), -10);
        Entry second = queries.createEntry(account1.getId(), 20);
        queries.createEntry(account2.getId(), 10);

        List<Entry> entries = queries.listEntries(account1.getId(), 10, 0);

        assertEquals(List.of(first, second), entries);
        assertEquals(List.of(second), queries.listEntries(account1.getId(), 10, 1));
        assertEquals(first, queries.getEntry(first.getId()).orElseThrow());
        assertTrue(queries.getEntry(-1L).isEmpty());
    }

    @Test
    @DisplayName("Entry for an unknown account is reported as not found")
    void testEntryForMissingAccount() {
        assertThrows(AccountNotFoundException.class, () -> queries.createEntry(-1L, 10));
    }

    @Test
    @DisplayName("Transfers are listed for either side of the account pair")
    void testCreateAndListTransfers() {
        Transfer outgoing = queries.createTransfer(account1.getId(), account2.getId(), 10);
        Transfer incoming = queries.createTransfer(account2.getId(), account1.getId(), 5);

        assertEquals(outgoing, queries.getTransfer(outgoing.getId()).orElseThrow());
        assertTrue(queries.getTransfer(-1L).isEmpty());
        assertEquals(List.of(outgoing), queries.listTransfers(account1.getId(), account1.getId() * -1, 10, 0));
        assertEquals(List.of(outgoing, incoming), queries.listTransfers(account1.getId(), account1.getId(), 10, 0));
    }

    @Test
    @DisplayName("Transfer to an unknown account is reported as not found")
    void testTransferForMissingAccount() {
        assertThrows(AccountNotFoundException.class,
                () -> queries.createTransfer(account1.getId(), -1L, 10));
    }

    @Test
    @DisplayName("Database rejects a non-positive transfer amount")
    void testTransferAmountConstraint() {
        assertThrows(DataIntegrityViolationException.class,
                () -> queries.createTransfer(account1.getId(), account2.getId(), 0));
    }
}
