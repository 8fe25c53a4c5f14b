package com.leadtracker.leadtracker.diff;

import com.leadtracker.leadtracker.ingest.CanonicalProperty;

public record RemovedPropertyEntry(CanonicalProperty property, RemovalResolution resolution, String reason) {

    public boolean deadLead() {
        return resolution == RemovalResolution.PRESUMED_DEAD_LEAD;
    }
}
