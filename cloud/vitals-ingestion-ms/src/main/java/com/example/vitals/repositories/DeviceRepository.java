package com.example.vitals.repositories;

import com.example.vitals.model.Device;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

@ApplicationScoped
public class DeviceRepository implements PanacheRepositoryBase<Device, String> {

    public boolean existsByApiKey(String apiKey) {
        return count("apiKey", apiKey) > 0;
    }
}
