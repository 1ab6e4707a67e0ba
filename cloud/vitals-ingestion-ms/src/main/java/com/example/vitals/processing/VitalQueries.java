package com.example.vitals.processing;

import com.example.vitals.errors.ApiException;
import com.example.vitals.errors.ErrorCode;
import com.example.vitals.model.VitalHistoryPage;
import com.example.vitals.model.VitalReading;
import com.example.vitals.repositories.VitalRepository;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

@ApplicationScoped
public class VitalQueries {

    static final int DEFAULT_PAGE_SIZE = 100;
    static final int MAX_PAGE_SIZE = 500;

    private static final List<Function<String, Instant>> INSTANT_FORMS = List.of(
        v -> OffsetDateTime.parse(v).toInstant(),
        v -> LocalDateTime.parse(v).toInstant(ZoneOffset.UTC),
        v -> LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private final VitalRepository vitalRepository;

    public VitalQueries(VitalRepository vitalRepository) {
        this.vitalRepository = vitalRepository;
    }

    public VitalReading latest(String patientId) {
        return vitalRepository
            .findLatest(patientId)
            .map(VitalReading::from)
            .orElseThrow(() -> new ApiException(ErrorCode.NOT_FOUND, "No readings for patient"));
    }

    /**
     * All arguments except {@code patientId} are raw query parameter values and
     * may be {@code null}.
     */
    public VitalHistoryPage history(
        String patientId,
        String from,
        String to,
        String page,
        String pageSize
    ) {
        Instant fromInstant;
        Instant toInstant;
        int pageNumber;
        int size;
        try {
            fromInstant = parseInstant(from);
            toInstant = parseInstant(to);
            pageNumber = Math.max(parseInt(page, 1), 1);
            size = Math.min(Math.max(parseInt(pageSize, DEFAULT_PAGE_SIZE), 1), MAX_PAGE_SIZE);
        } catch (IllegalArgumentException e) {
            throw new ApiException(ErrorCode.BAD_REQUEST, "Invalid query parameters", e.getMessage());
        }

        VitalHistoryPage out = new VitalHistoryPage();
        out.page = pageNumber;
        out.pageSize = size;
        out.total = vitalRepository.countInRange(patientId, fromInstant, toInstant);
        out.results = vitalRepository
            .findInRange(patientId, fromInstant, toInstant, pageNumber - 1, size)
            .stream()
            .map(VitalReading::from)
            .collect(Collectors.toList());
        return out;
    }

    /**
     * Accepts an offset date-time ({@code Z} allowed), a local date-time taken as
     * UTC, or a plain date meaning the start of that day in UTC.
     */
    static Instant parseInstant(String value) {
        if (value == null || value.isEmpty()) return null;
        DateTimeParseException last = null;
        for (Function<String, Instant> form : INSTANT_FORMS) {
            try {
                return form.apply(value);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw new IllegalArgumentException("Invalid datetime: " + value, last);
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isEmpty()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer: " + value, e);
        }
    }
}
