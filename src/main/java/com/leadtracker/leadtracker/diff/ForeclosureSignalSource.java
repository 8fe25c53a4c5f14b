package com.leadtracker.leadtracker.diff;

/**
 * Supplies the current foreclosure and sale records, maintained outside the ingestion flow.
 */
public interface ForeclosureSignalSource {

    ForeclosureSignal load();
}
