package com.example.vitals.processing;

import com.example.vitals.errors.ApiException;
import com.example.vitals.errors.ErrorCode;
import com.example.vitals.errors.KeyConflicts;
import com.example.vitals.model.Device;
import com.example.vitals.model.DeviceType;
import com.example.vitals.model.Patient;
import com.example.vitals.repositories.DeviceRepository;
import com.example.vitals.repositories.PatientRepository;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Binds devices to patients and issues their API keys.
 * <p>
 * Registration is idempotent by device id: a known id always gets its
 * original key back and nothing is overwritten. Two registrations racing for
 * the same new id are arbitrated by the primary key; the loser retries in a
 * fresh transaction and observes the winner's row. No in-process lock is
 * involved, several instances may share one database.
 */
@ApplicationScoped
public class DeviceRegistry {

    private static final Logger LOG = Logger.getLogger(DeviceRegistry.class);
    private static final int MAX_ATTEMPTS = 5;
    private static final long BACKOFF_MILLIS = 20;
    private static final int KEY_BYTES = 24;

    private final DeviceRepository deviceRepository;
    private final PatientRepository patientRepository;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public DeviceRegistry(
        DeviceRepository deviceRepository,
        PatientRepository patientRepository,
        Clock clock
    ) {
        this.deviceRepository = deviceRepository;
        this.patientRepository = patientRepository;
        this.clock = clock;
    }

    public Registration register(String deviceId, String deviceType, String patientId) {
        DeviceType type = DeviceType
            .fromCode(deviceType)
            .orElseThrow(() ->
                new ApiException(
                    ErrorCode.VALIDATION_ERROR,
                    "Invalid payload",
                    Map.of("type", List.of("Must be one of: " + DeviceType.codes() + "."))
                )
            );

        RuntimeException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                return QuarkusTransaction
                    .requiringNew()
                    .call(() -> findOrRegister(deviceId, type, patientId));
            } catch (RuntimeException e) {
                if (!KeyConflicts.isKeyConflict(e)) throw e;
                LOG.infof(
                    "Concurrent registration detected for device %s (attempt %d)",
                    deviceId,
                    attempt
                );
                lastConflict = e;
                if (attempt < MAX_ATTEMPTS) backOff(attempt);
            }
        }
        throw lastConflict;
    }

    /**
     * Returns the patient with the given id, creating a placeholder record when
     * none exists yet.
     */
    @Transactional(Transactional.TxType.MANDATORY)
    public Patient findOrCreatePatient(String patientId) {
        return patientRepository
            .findByIdOptional(patientId)
            .orElseGet(() -> {
                Patient patient = Patient.placeholder(patientId);
                patientRepository.persistAndFlush(patient);
                LOG.infof("Provisioned patient %s", patientId);
                return patient;
            });
    }

    private Registration findOrRegister(String deviceId, DeviceType type, String patientId) {
        Device existing = deviceRepository.findById(deviceId);
        if (existing != null) {
            LOG.debugf("Device %s already registered", deviceId);
            return new Registration(existing.id, existing.apiKey, true);
        }

        Device device = new Device();
        device.id = deviceId;
        device.type = type;
        device.patient = findOrCreatePatient(patientId);
        device.apiKey = mintApiKey();
        device.registeredAt = Instant.now(clock);
        deviceRepository.persistAndFlush(device);

        LOG.infof("Registered %s device %s for patient %s", type.code(), deviceId, patientId);
        return new Registration(device.id, device.apiKey, false);
    }

    // gives the winning transaction time to commit before we look again
    private static void backOff(int attempt) {
        try {
            Thread.sleep(BACKOFF_MILLIS * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while registering device", e);
        }
    }

    private String mintApiKey() {
        byte[] bytes = new byte[KEY_BYTES];
        random.nextBytes(bytes);
        return "key_" + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
