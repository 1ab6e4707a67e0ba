package com.example.vitals.repositories;

import com.example.vitals.model.Vital;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class VitalRepository implements PanacheRepositoryBase<Vital, String> {

    // newest first; id breaks ties between identical timestamps
    private static final Sort NEWEST_FIRST = Sort
        .by("recordedAt", Sort.Direction.Descending)
        .and("id", Sort.Direction.Descending);

    public Optional<Vital> findLatest(String patientId) {
        return find("patientId", NEWEST_FIRST, patientId).firstResultOptional();
    }

    public long countInRange(String patientId, Instant from, Instant to) {
        Parameters params = rangeParameters(patientId, from, to);
        return count(rangeQuery(from, to), params);
    }

    /**
     * @param pageIndex zero-based page index
     */
    public List<Vital> findInRange(
        String patientId,
        Instant from,
        Instant to,
        int pageIndex,
        int pageSize
    ) {
        long first = (long) pageIndex * pageSize;
        if (first > Integer.MAX_VALUE) {
            return List.of();
        }
        long last = Math.min(first + pageSize - 1, Integer.MAX_VALUE);
        PanacheQuery<Vital> query = find(
            rangeQuery(from, to),
            NEWEST_FIRST,
            rangeParameters(patientId, from, to)
        );
        return query.range((int) first, (int) last).list();
    }

    private static String rangeQuery(Instant from, Instant to) {
        StringBuilder query = new StringBuilder("patientId = :patientId");
        if (from != null) query.append(" and recordedAt >= :from");
        if (to != null) query.append(" and recordedAt <= :to");
        return query.toString();
    }

    private static Parameters rangeParameters(String patientId, Instant from, Instant to) {
        Parameters params = Parameters.with("patientId", patientId);
        if (from != null) params.and("from", from);
        if (to != null) params.and("to", to);
        return params;
    }
}
