package com.example.vitals.processing;

import com.example.vitals.errors.ApiException;
import com.example.vitals.errors.DuplicateIngestionException;
import com.example.vitals.errors.ErrorCode;
import com.example.vitals.model.Identifiers;
import com.example.vitals.model.Vital;
import com.example.vitals.model.VitalIn;
import com.example.vitals.repositories.VitalRepository;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Write path for vital signs: authorize, validate, deduplicate, store.
 * <p>
 * Nothing is written until the payload has passed authorization and
 * validation. The idempotency record and the vital row are committed in the
 * same transaction, so a failed vital insert never leaves a token behind that
 * would turn the caller's retry into a false duplicate.
 */
@ApplicationScoped
public class IngestionPipeline {

    private static final Logger LOG = Logger.getLogger(IngestionPipeline.class);

    private final CredentialStore credentialStore;
    private final PayloadReader payloadReader;
    private final IdempotencyLedger ledger;
    private final VitalRepository vitalRepository;

    public IngestionPipeline(
        CredentialStore credentialStore,
        PayloadReader payloadReader,
        IdempotencyLedger ledger,
        VitalRepository vitalRepository
    ) {
        this.credentialStore = credentialStore;
        this.payloadReader = payloadReader;
        this.ledger = ledger;
        this.vitalRepository = vitalRepository;
    }

    public IngestionResult ingest(
        String patientId,
        String payload,
        String apiKey,
        String idempotencyHeader
    ) {
        credentialStore.requireAuthorized(apiKey);
        VitalIn in = payloadReader.read(payload, VitalIn.class);
        String token = resolveToken(idempotencyHeader, in);
        requireIdentifierLengths(patientId, token);

        try {
            IngestionResult result = QuarkusTransaction
                .requiringNew()
                .call(() -> record(patientId, in, token));
            if (!result.isStored()) {
                LOG.infof(
                    "Duplicate ingestion ignored for device %s, patient %s",
                    in.deviceId,
                    patientId
                );
            }
            return result;
        } catch (DuplicateIngestionException e) {
            LOG.infof("Lost idempotency race for %s, reporting duplicate", e.getIdemKey());
            return IngestionResult.duplicate();
        }
    }

    static String resolveToken(String idempotencyHeader, VitalIn in) {
        if (idempotencyHeader != null && !idempotencyHeader.isEmpty()) {
            return idempotencyHeader;
        }
        return in.idempotencyKey;
    }

    private static void requireIdentifierLengths(String patientId, String token) {
        Map<String, List<String>> details = new TreeMap<>();
        if (patientId != null && patientId.length() > Identifiers.MAX_LENGTH) {
            details.put("patient_id", List.of(tooLong()));
        }
        if (token != null && token.length() > Identifiers.MAX_LENGTH) {
            details.put("idempotency_key", List.of(tooLong()));
        }
        if (!details.isEmpty()) {
            throw new ApiException(ErrorCode.VALIDATION_ERROR, "Invalid payload", details);
        }
    }

    private static String tooLong() {
        return "Longer than maximum length " + Identifiers.MAX_LENGTH + ".";
    }

    private IngestionResult record(String patientId, VitalIn in, String token) {
        if (!ledger.checkAndRecord(in.deviceId, token)) {
            return IngestionResult.duplicate();
        }

        Vital vital = new Vital();
        vital.id = newVitalId();
        vital.patientId = patientId;
        vital.recordedAt = in.timestamp.toInstant();
        vital.heartRate = in.heartRate;
        if (in.bp != null) {
            vital.bpSystolic = in.bp.systolic;
            vital.bpDiastolic = in.bp.diastolic;
        }
        vital.spo2 = in.spo2;
        vital.temperature = in.temp;
        vital.deviceId = in.deviceId;
        vitalRepository.persist(vital);

        LOG.infof("Stored vital %s for patient %s from device %s", vital.id, patientId, in.deviceId);
        return IngestionResult.stored(vital.id);
    }

    private static String newVitalId() {
        return "v_" + UUID.randomUUID().toString().replace("-", "");
    }
}
