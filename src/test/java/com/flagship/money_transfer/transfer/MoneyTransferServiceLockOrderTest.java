package com.flagship.money_transfer.transfer;

import com.flagship.money_transfer.ledger.Account;
import com.flagship.money_transfer.ledger.CurrencyCode;
import com.flagship.money_transfer.ledger.Entry;
import com.flagship.money_transfer.ledger.Transfer;
import com.flagship.money_transfer.observability.TransferMetrics;
import com.flagship.money_transfer.store.QueryHandle;
import com.flagship.money_transfer.store.TransactionExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * Order of the writes and row locks a transfer issues, whichever direction it goes.
 */
@ExtendWith(MockitoExtension.class)
class MoneyTransferServiceLockOrderTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private TransactionStatus status;

    @Mock
    private QueryHandle queries;

    private MoneyTransferService service;

    @BeforeEach
    void setUp() {
        when(transactionManager.getTransaction(any())).thenReturn(status);
        when(queries.createTransfer(anyLong(), anyLong(), anyLong())).thenAnswer(invocation ->
                new Transfer(1L, invocation.getArgument(0), invocation.getArgument(1),
                        invocation.getArgument(2), NOW));
        when(queries.createEntry(anyLong(), anyLong())).thenAnswer(invocation ->
                new Entry(1L, invocation.getArgument(0), invocation.getArgument(1), NOW));
        when(queries.getAccountForUpdate(anyLong())).thenAnswer(invocation ->
                account(invocation.getArgument(0), 100));
        when(queries.updateAccount(anyLong(), anyLong())).thenAnswer(invocation ->
                account(invocation.getArgument(0), invocation.getArgument(1)));

        service = new MoneyTransferService(new TransactionExecutor(transactionManager, queries),
                new TransferMetrics(new SimpleMeterRegistry()));
    }

    private static Account account(long id, long balance) {
        return new Account(id, "owner-" + id, balance, CurrencyCode.USD, NOW);
    }

    @Test
    @DisplayName("Transfer towards a lower id locks the destination first")
    void testHigherToLowerLocksDestinationFirst() {
        TransferResult result = service.transferMoney(TransferRequest.of(5L, 2L, 1));

        InOrder inOrder = inOrder(queries);
        inOrder.verify(queries).createTransfer(5L, 2L, 1L);
        inOrder.verify(queries).createEntry(5L, -1L);
        inOrder.verify(queries).createEntry(2L, 1L);
        inOrder.verify(queries).getAccountForUpdate(2L);
        inOrder.verify(queries).updateAccount(2L, 101L);
        inOrder.verify(queries).getAccountForUpdate(5L);
        inOrder.verify(queries).updateAccount(5L, 99L);

        assertEquals(99, result.getFromAccount().getBalance());
        assertEquals(101, result.getToAccount().getBalance());
        verify(transactionManager).commit(status);
    }

    @Test
    @DisplayName("Transfer towards a higher id locks the source first")
    void testLowerToHigherLocksSourceFirst() {
        service.transferMoney(TransferRequest.of(2L, 5L, 1));

        InOrder inOrder = inOrder(queries);
        inOrder.verify(queries).getAccountForUpdate(2L);
        inOrder.verify(queries).updateAccount(2L, 99L);
        inOrder.verify(queries).getAccountForUpdate(5L);
        inOrder.verify(queries).updateAccount(5L, 101L);
    }
}
