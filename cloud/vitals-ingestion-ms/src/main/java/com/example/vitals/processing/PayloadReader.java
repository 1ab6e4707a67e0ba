package com.example.vitals.processing;

import com.example.vitals.errors.ApiException;
import com.example.vitals.errors.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Path;
import jakarta.validation.Validator;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Turns a raw JSON request body into a validated payload object.
 * Every failure is reported as {@code validation_error} with details keyed by
 * the JSON field path, e.g. {@code bp.systolic}.
 */
@ApplicationScoped
public class PayloadReader {

    private static final String BODY_FIELD = "_body";
    private static final PropertyNamingStrategies.NamingBase JSON_NAMES =
        new PropertyNamingStrategies.SnakeCaseStrategy();

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public PayloadReader(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    public <T> T read(String body, Class<T> type) {
        if (body == null || body.isBlank()) {
            throw invalid(Map.of(BODY_FIELD, List.of("Request body must be a JSON object.")));
        }
        T payload;
        try {
            payload = objectMapper.readValue(body, type);
        } catch (JsonMappingException e) {
            throw invalid(Map.of(fieldOf(e), List.of(e.getOriginalMessage())));
        } catch (JsonProcessingException e) {
            throw invalid(Map.of(BODY_FIELD, List.of(e.getOriginalMessage())));
        }
        if (payload == null) {
            throw invalid(Map.of(BODY_FIELD, List.of("Request body must be a JSON object.")));
        }

        Set<ConstraintViolation<T>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            Map<String, List<String>> details = violations
                .stream()
                .collect(
                    Collectors.groupingBy(
                        v -> jsonPath(v.getPropertyPath()),
                        TreeMap::new,
                        Collectors.mapping(
                            ConstraintViolation::getMessage,
                            Collectors.toList()
                        )
                    )
                );
            throw invalid(details);
        }
        return payload;
    }

    private static ApiException invalid(Map<String, List<String>> details) {
        return new ApiException(ErrorCode.VALIDATION_ERROR, "Invalid payload", details);
    }

    private static String fieldOf(JsonMappingException e) {
        String path = e
            .getPath()
            .stream()
            .map(ref -> ref.getFieldName() != null
                ? ref.getFieldName()
                : String.valueOf(ref.getIndex()))
            .collect(Collectors.joining("."));
        return path.isEmpty() ? BODY_FIELD : path;
    }

    private static String jsonPath(Path propertyPath) {
        List<String> names = new ArrayList<>();
        for (Path.Node node : propertyPath) {
            if (node.getName() != null) names.add(JSON_NAMES.translate(node.getName()));
        }
        return String.join(".", names);
    }
}
