package com.leadtracker.leadtracker.diff;

import com.leadtracker.leadtracker.ingest.PropertyStatus;

public enum TransitionKind {
    ESCALATION,
    CRITICAL,
    ORDINARY;

    /**
     * PENDING to ACTIVE escalates, ACTIVE to JUDGMENT is critical, anything else is ordinary.
     */
    public static TransitionKind of(PropertyStatus from, PropertyStatus to) {
        if (from == PropertyStatus.PENDING && to == PropertyStatus.ACTIVE) {
            return ESCALATION;
        }
        if (from == PropertyStatus.ACTIVE && to == PropertyStatus.JUDGMENT) {
            return CRITICAL;
        }
        return ORDINARY;
    }
}
