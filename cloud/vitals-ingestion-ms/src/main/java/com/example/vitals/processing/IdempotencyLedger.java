package com.example.vitals.processing;

import com.example.vitals.errors.DuplicateIngestionException;
import com.example.vitals.errors.KeyConflicts;
import com.example.vitals.model.IdempotencyRecord;
import com.example.vitals.repositories.IdempotencyRecordRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import java.time.Clock;
import java.time.Instant;
import org.jboss.logging.Logger;

/**
 * Records which (device, client token) pairs have already been ingested.
 * <p>
 * Records are never expired. Arbitration between concurrent callers is left
 * to the unique constraint on {@code idem_key}: the ledger has to run inside
 * the caller's transaction so that a lost race rolls back the whole unit of
 * work, see {@link DuplicateIngestionException}.
 */
@ApplicationScoped
public class IdempotencyLedger {

    private static final Logger LOG = Logger.getLogger(IdempotencyLedger.class);

    private final IdempotencyRecordRepository records;
    private final Clock clock;

    public IdempotencyLedger(IdempotencyRecordRepository records, Clock clock) {
        this.records = records;
        this.clock = clock;
    }

    /**
     * @return {@code true} when this is the first time the token is seen for the
     *     device, or when no token was supplied at all
     * @throws DuplicateIngestionException when a concurrent transaction recorded
     *     the same key first
     */
    @Transactional(Transactional.TxType.MANDATORY)
    public boolean checkAndRecord(String deviceId, String token) {
        if (token == null || token.isEmpty()) {
            return true;
        }
        String idemKey = IdempotencyRecord.compositeKey(deviceId, token);
        if (records.existsByKey(idemKey)) {
            LOG.debugf("Idempotency key %s already recorded", idemKey);
            return false;
        }

        IdempotencyRecord record = new IdempotencyRecord();
        record.deviceId = deviceId;
        record.idemKey = idemKey;
        record.createdAt = Instant.now(clock);
        try {
            records.persistAndFlush(record);
        } catch (PersistenceException e) {
            if (KeyConflicts.isKeyConflict(e)) {
                throw new DuplicateIngestionException(idemKey, e);
            }
            throw e;
        }
        return true;
    }
}
