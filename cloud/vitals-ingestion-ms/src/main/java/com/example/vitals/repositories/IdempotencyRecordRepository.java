package com.example.vitals.repositories;

import com.example.vitals.model.IdempotencyRecord;
import io.quarkus.hibernate.orm.panache.PanacheRepository;
import jakarta.enterprise.context.ApplicationScoped;

@ApplicationScoped
public class IdempotencyRecordRepository implements PanacheRepository<IdempotencyRecord> {

    public boolean existsByKey(String idemKey) {
        return count("idemKey", idemKey) > 0;
    }
}
