package com.example.vitals.web;

import com.example.vitals.model.Vital;
import com.example.vitals.repositories.VitalRepository;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.path.json.JsonPath;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusTest
class VitalHistoryTest {

    static final Instant BASE = Instant.parse("2024-01-01T00:00:00Z");

    @Inject
    VitalRepository vitalRepository;

    String patientId;

    @BeforeEach
    void seed() {
        patientId = "p_" + UUID.randomUUID();
        QuarkusTransaction.requiringNew().run(() -> {
            for (int i = 0; i < 250; i++) {
                Vital v = new Vital();
                v.id = "v_" + UUID.randomUUID().toString().replace("-", "");
                v.patientId = patientId;
                v.recordedAt = BASE.plusSeconds(60L * i);
                v.heartRate = 60 + (i % 40);
                v.deviceId = "dev_hist";
                vitalRepository.persist(v);
            }
        });
    }

    JsonPath page(int page, int pageSize) {
        return given()
            .queryParam("page", page)
            .queryParam("page_size", pageSize)
            .when().get("/api/v1/patients/" + patientId + "/history")
            .then()
            .statusCode(200)
            .extract().jsonPath();
    }

    @Test
    void pagesSplitTheHistoryNewestFirst() {
        int[] expectedSizes = { 100, 100, 50 };
        List<Instant> seen = new ArrayList<>();

        for (int p = 1; p <= 3; p++) {
            JsonPath body = page(p, 100);
            assertEquals(250, body.getInt("total"));
            assertEquals(p, body.getInt("page"));
            assertEquals(100, body.getInt("page_size"));
            List<String> stamps = body.getList("results.timestamp");
            assertEquals(expectedSizes[p - 1], stamps.size());
            stamps.forEach(s -> seen.add(Instant.parse(s)));
        }

        assertEquals(250, seen.size());
        for (int i = 1; i < seen.size(); i++) {
            assertTrue(seen.get(i - 1).isAfter(seen.get(i)), "not strictly descending at " + i);
        }
        assertEquals(BASE.plusSeconds(60L * 249), seen.get(0));
        assertEquals(BASE, seen.get(seen.size() - 1));
    }

    @Test
    void defaultsAndClamping() {
        given()
            .when().get("/api/v1/patients/" + patientId + "/history")
            .then()
            .statusCode(200)
            .body("page", is(1))
            .body("page_size", is(100))
            .body("total", is(250))
            .body("results.size()", is(100));

        given()
            .queryParam("page", 0)
            .queryParam("page_size", 10_000)
            .when().get("/api/v1/patients/" + patientId + "/history")
            .then()
            .statusCode(200)
            .body("page", is(1))
            .body("page_size", is(500))
            .body("results.size()", is(250));

        given()
            .queryParam("page_size", -3)
            .when().get("/api/v1/patients/" + patientId + "/history")
            .then()
            .statusCode(200)
            .body("page_size", is(1))
            .body("results.size()", is(1));
    }

    @Test
    void rangeFiltersAreInclusive() {
        // minutes 10..19 inclusive
        given()
            .queryParam("from", "2024-01-01T00:10:00Z")
            .queryParam("to", "2024-01-01T00:19:00Z")
            .when().get("/api/v1/patients/" + patientId + "/history")
            .then()
            .statusCode(200)
            .body("total", is(10))
            .body("results[0].timestamp", is("2024-01-01T00:19:00Z"))
            .body("results[9].timestamp", is("2024-01-01T00:10:00Z"));

        given()
            .queryParam("from", "2024-01-01T04:00:00")
            .when().get("/api/v1/patients/" + patientId + "/history")
            .then()
            .statusCode(200)
            .body("total", is(10));

        given()
            .queryParam("to", "2024-01-01")
            .when().get("/api/v1/patients/" + patientId + "/history")
            .then()
            .statusCode(200)
            .body("total", is(1));
    }

    @Test
    void pageBeyondTheEndIsEmpty() {
        JsonPath body = page(4, 100);
        assertEquals(250, body.getInt("total"));
        assertEquals(0, body.getList("results").size());
    }

    @Test
    void pageFarBeyondTheEndIsEmptyNotAnError() {
        given()
            .queryParam("page", 5_000_000)
            .queryParam("page_size", 500)
            .when().get("/api/v1/patients/" + patientId + "/history")
            .then()
            .statusCode(200)
            .body("page", is(5_000_000))
            .body("total", is(250))
            .body("results.size()", is(0));

        given()
            .queryParam("page", Integer.MAX_VALUE)
            .queryParam("page_size", 1)
            .when().get("/api/v1/patients/" + patientId + "/history")
            .then()
            .statusCode(200)
            .body("results.size()", is(0));
    }

    @Test
    void malformedParametersAreBadRequests() {
        given()
            .queryParam("from", "last tuesday")
            .when().get("/api/v1/patients/" + patientId + "/history")
            .then()
            .statusCode(400)
            .body("code", is("bad_request"))
            .body("message", is("Invalid query parameters"))
            .body("details", containsString("last tuesday"));

        given()
            .queryParam("page", "two")
            .when().get("/api/v1/patients/" + patientId + "/history")
            .then()
            .statusCode(400)
            .body("code", is("bad_request"));
    }

    @Test
    void unknownPatientHasEmptyHistory() {
        given()
            .when().get("/api/v1/patients/p_" + UUID.randomUUID() + "/history")
            .then()
            .statusCode(200)
            .body("total", is(0))
            .body("results.size()", is(0));
    }
}
