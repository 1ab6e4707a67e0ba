package com.example.vitals.processing;

import com.example.vitals.errors.ApiException;
import com.example.vitals.errors.ErrorCode;
import com.example.vitals.repositories.DeviceRepository;
import jakarta.enterprise.context.ApplicationScoped;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Decides whether a write request carries a usable credential: the
 * process-wide master key or any key issued to a registered device.
 */
@ApplicationScoped
public class CredentialStore {

    private static final Logger LOG = Logger.getLogger(CredentialStore.class);

    private final DeviceRepository deviceRepository;
    private final byte[] masterKey;

    public CredentialStore(
        DeviceRepository deviceRepository,
        @ConfigProperty(name = "vitals.device.master-key") String masterKey
    ) {
        this.deviceRepository = deviceRepository;
        this.masterKey = masterKey.getBytes(StandardCharsets.UTF_8);
    }

    public AuthorizationResult authorize(String suppliedKey) {
        if (suppliedKey == null || suppliedKey.isEmpty()) {
            return AuthorizationResult.MISSING;
        }
        if (MessageDigest.isEqual(masterKey, suppliedKey.getBytes(StandardCharsets.UTF_8))) {
            return AuthorizationResult.MASTER_KEY;
        }
        if (deviceRepository.existsByApiKey(suppliedKey)) {
            return AuthorizationResult.DEVICE_KEY;
        }
        LOG.warn("Rejected write with an unknown API key");
        return AuthorizationResult.INVALID;
    }

    public AuthorizationResult requireAuthorized(String suppliedKey) {
        AuthorizationResult result = authorize(suppliedKey);
        if (result.isAuthorized()) return result;
        throw switch (result.failure()) {
            case MISSING_API_KEY -> new ApiException(
                ErrorCode.MISSING_API_KEY,
                "X-API-Key header required"
            );
            default -> new ApiException(ErrorCode.INVALID_API_KEY, "Invalid API key");
        };
    }
}
