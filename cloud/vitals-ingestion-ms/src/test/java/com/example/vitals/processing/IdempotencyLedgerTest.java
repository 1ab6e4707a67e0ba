package com.example.vitals.processing;

import com.example.vitals.model.IdempotencyRecord;
import com.example.vitals.repositories.IdempotencyRecordRepository;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.TransactionalException;
import java.util.UUID;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
class IdempotencyLedgerTest {

    @Inject
    IdempotencyLedger ledger;

    @Inject
    IdempotencyRecordRepository records;

    boolean checkAndRecord(String deviceId, String token) {
        return QuarkusTransaction.requiringNew().call(() -> ledger.checkAndRecord(deviceId, token));
    }

    long recordsFor(String deviceId) {
        return QuarkusTransaction.requiringNew().call(() -> records.count("deviceId", deviceId));
    }

    @Test
    void firstSightingIsNewThenDuplicate() {
        String deviceId = "dev_" + UUID.randomUUID();

        assertTrue(checkAndRecord(deviceId, "t-1"));
        assertFalse(checkAndRecord(deviceId, "t-1"));
        assertFalse(checkAndRecord(deviceId, "t-1"));
        assertEquals(1L, recordsFor(deviceId));
    }

    @Test
    void recordUsesDeviceScopedCompositeKey() {
        String deviceId = "dev_" + UUID.randomUUID();
        checkAndRecord(deviceId, "tok");

        IdempotencyRecord record = QuarkusTransaction.requiringNew().call(() ->
            records.find("deviceId", deviceId).firstResult()
        );
        assertEquals(deviceId + ":tok", record.idemKey);
        assertNotNull(record.createdAt);
    }

    @Test
    void sameTokenOnAnotherDeviceIsNew() {
        String first = "dev_" + UUID.randomUUID();
        String second = "dev_" + UUID.randomUUID();

        assertTrue(checkAndRecord(first, "shared"));
        assertTrue(checkAndRecord(second, "shared"));
    }

    @Test
    void missingTokenIsAlwaysNewAndNotRecorded() {
        String deviceId = "dev_" + UUID.randomUUID();

        assertTrue(checkAndRecord(deviceId, null));
        assertTrue(checkAndRecord(deviceId, null));
        assertTrue(checkAndRecord(deviceId, ""));
        assertEquals(0L, recordsFor(deviceId));
    }

    @Test
    void recordIsDiscardedWhenTheUnitOfWorkRollsBack() {
        String deviceId = "dev_" + UUID.randomUUID();

        assertThrows(IllegalStateException.class, () ->
            QuarkusTransaction.requiringNew().run(() -> {
                ledger.checkAndRecord(deviceId, "rolled-back");
                throw new IllegalStateException("vital insert failed");
            })
        );

        assertTrue(checkAndRecord(deviceId, "rolled-back"));
    }

    @Test
    void requiresAnEnclosingTransaction() {
        assertThrows(TransactionalException.class, () -> ledger.checkAndRecord("dev", "tok"));
    }
}
