package com.example.vitals.processing;

import com.example.vitals.repositories.DeviceRepository;
import com.example.vitals.repositories.VitalRepository;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@QuarkusTest
class ConcurrentWritesTest {

    static final String MASTER_KEY = "test-master-key";
    static final int CALLERS = 8;

    @Inject
    IngestionPipeline pipeline;

    @Inject
    DeviceRegistry registry;

    @Inject
    VitalRepository vitalRepository;

    @Inject
    DeviceRepository deviceRepository;

    ExecutorService executor;

    @BeforeEach
    void start() {
        executor = Executors.newFixedThreadPool(CALLERS);
    }

    @AfterEach
    void stop() {
        executor.shutdownNow();
    }

    <T> List<T> runTogether(Callable<T> task) throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < CALLERS; i++) {
            futures.add(executor.submit(() -> {
                gate.await();
                return task.call();
            }));
        }
        gate.countDown();
        List<T> results = new ArrayList<>();
        for (Future<T> f : futures) {
            results.add(f.get(30, TimeUnit.SECONDS));
        }
        return results;
    }

    @Test
    void onlyOneConcurrentReplayIsStored() throws Exception {
        String patientId = "p_" + UUID.randomUUID();
        String body = """
            {"device_id": "dev_race", "timestamp": "2024-01-01T00:00:00Z", "heart_rate": 75}
            """;

        List<IngestionResult> results = runTogether(() ->
            pipeline.ingest(patientId, body, MASTER_KEY, "race-token-" + patientId)
        );

        long stored = results.stream().filter(IngestionResult::isStored).count();
        assertEquals(1L, stored);
        long persisted = QuarkusTransaction.requiringNew().call(() ->
            vitalRepository.count("patientId", patientId)
        );
        assertEquals(1L, persisted);
    }

    @Test
    void concurrentRegistrationsAgreeOnOneKey() throws Exception {
        String deviceId = "dev_" + UUID.randomUUID();
        String patientId = "p_" + UUID.randomUUID();

        List<Registration> results = runTogether(() -> registry.register(deviceId, "hr", patientId));

        List<String> keys = results
            .stream()
            .map(Registration::apiKey)
            .distinct()
            .collect(Collectors.toList());
        assertEquals(1, keys.size());
        assertEquals(1L, results.stream().filter(r -> !r.alreadyExisted()).count());

        String storedKey = QuarkusTransaction.requiringNew().call(() ->
            deviceRepository.findById(deviceId).apiKey
        );
        assertEquals(keys.get(0), storedKey);
    }
}
