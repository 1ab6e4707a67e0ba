package com.example.vitals.processing;

public final class IngestionResult {

    private static final IngestionResult DUPLICATE = new IngestionResult(null);

    private final String vitalId;

    private IngestionResult(String vitalId) {
        this.vitalId = vitalId;
    }

    static IngestionResult stored(String vitalId) {
        return new IngestionResult(vitalId);
    }

    static IngestionResult duplicate() {
        return DUPLICATE;
    }

    public boolean isStored() {
        return vitalId != null;
    }

    /** Id of the new vital, {@code null} for a replayed token. */
    public String vitalId() {
        return vitalId;
    }

    public String status() {
        return isStored() ? "stored" : "duplicate_ignored";
    }
}
