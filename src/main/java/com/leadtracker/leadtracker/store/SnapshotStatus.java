package com.leadtracker.leadtracker.store;

public enum SnapshotStatus {
    PROCESSING,
    COMPLETED,
    ERROR
}
