package com.leadtracker.leadtracker.diff;

import com.leadtracker.leadtracker.ingest.CanonicalProperty;

public record NewPropertyEntry(CanonicalProperty property, boolean newLead) {
}
