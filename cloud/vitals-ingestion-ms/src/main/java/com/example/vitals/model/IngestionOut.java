package com.example.vitals.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestionOut {
    public String vitalId;
    public String status; // stored / duplicate_ignored
}
