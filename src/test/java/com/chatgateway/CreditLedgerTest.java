package com.chatgateway;

import com.chatgateway.storage.FileConversationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CreditLedgerTest {

    @TempDir
    Path dataRoot;

    private CreditLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new CreditLedger(new FileConversationStore(dataRoot, 10));
    }

    @Test
    void deductsExactCost() {
        assertEquals(7, ledger.deduct("alice", 3));
        assertEquals(7, ledger.balance("alice"));
    }

    @Test
    void zeroCostLeavesBalanceAlone() {
        assertEquals(10, ledger.deduct("alice", 0));
        assertEquals(10, ledger.balance("alice"));
    }

    @Test
    void overdraftIsRejectedWithoutChange() {
        GatewayException error = assertThrows(GatewayException.class, () -> ledger.deduct("alice", 11));
        assertEquals(ErrorKind.INSUFFICIENT_CREDIT, error.getKind());
        assertEquals(10, ledger.balance("alice"));
    }

    @Test
    void operatorDeductionIsConditional() {
        assertEquals(6, ledger.deductCredit("alice", 4));
        GatewayException error = assertThrows(GatewayException.class, () -> ledger.deductCredit("alice", 7));
        assertEquals(ErrorKind.INSUFFICIENT_CREDIT, error.getKind());
        assertEquals(6, ledger.balance("alice"));
        assertThrows(IllegalArgumentException.class, () -> ledger.deductCredit("alice", 0));
    }

    @Test
    void refundRestoresCharge() {
        ledger.deduct("alice", 4);
        assertEquals(10, ledger.refund("alice", 4));
    }

    @Test
    void addAndSetCredit() {
        assertEquals(15, ledger.addCredit("alice", 5));
        assertEquals(2, ledger.setCredit("alice", 2));
        assertThrows(IllegalArgumentException.class, () -> ledger.addCredit("alice", 0));
        assertThrows(IllegalArgumentException.class, () -> ledger.setCredit("alice", -1));
    }

    @Test
    void concurrentDeductionsNeverOverdraw() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 25; i++) {
                results.add(pool.submit(() -> {
                    try {
                        ledger.deduct("alice", 1);
                        return true;
                    } catch (GatewayException e) {
                        return false;
                    }
                }));
            }
            int charged = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    charged++;
                }
            }
            assertEquals(10, charged);
            assertEquals(0, ledger.balance("alice"));
        } finally {
            pool.shutdownNow();
        }
    }
}
