package com.leadtracker.leadtracker.diff;

/**
 * Outcome for an account that dropped off the delinquent list.
 */
public enum RemovalResolution {
    /** No foreclosure or sale record matches; the debt was most likely paid. */
    PRESUMED_DEAD_LEAD,
    /** A foreclosure or sale record matches; the removal is not treated as a dead lead. */
    UNRESOLVED
}
