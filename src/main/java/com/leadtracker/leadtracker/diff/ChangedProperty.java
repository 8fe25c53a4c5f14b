package com.leadtracker.leadtracker.diff;

import com.leadtracker.leadtracker.ingest.CanonicalProperty;
import com.leadtracker.leadtracker.ingest.PropertyStatus;

/**
 * An account present in both snapshots whose status or percentage due differs.
 */
public record ChangedProperty(
        CanonicalProperty current,
        CanonicalProperty previous,
        boolean statusChanged,
        boolean percentageChanged
) {

    public String accountNumber() {
        return current.accountNumber();
    }

    public PropertyStatus previousStatus() {
        return previous.status();
    }
}
