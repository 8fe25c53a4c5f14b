package com.leadtracker.leadtracker.diff;

import com.leadtracker.leadtracker.ingest.CanonicalProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Partitions the current snapshot against the previous one by account number.
 */
@Component
public class SnapshotComparator {

    private static final Logger log = LoggerFactory.getLogger(SnapshotComparator.class);

    private static final Comparator<CanonicalProperty> BY_ACCOUNT =
            Comparator.comparing(CanonicalProperty::accountNumber);

    /**
     * Compares two record sets. A null or empty previous set makes every current record new.
     * Duplicate accounts within a side keep the record with the highest source row index.
     */
    public SnapshotComparison compare(List<CanonicalProperty> current, List<CanonicalProperty> previous) {
        DedupedSide currentSide = dedupe(current, "current");
        DedupedSide previousSide = dedupe(previous, "previous");

        List<CanonicalProperty> newProperties = new ArrayList<>();
        List<CanonicalProperty> unchangedProperties = new ArrayList<>();
        List<ChangedProperty> changedProperties = new ArrayList<>();

        for (CanonicalProperty property : currentSide.byAccount().values()) {
            CanonicalProperty before = previousSide.byAccount().get(property.accountNumber());
            if (before == null) {
                newProperties.add(property);
                continue;
            }
            boolean statusChanged = property.status() != before.status();
            boolean percentageChanged = property.percentageDue() != before.percentageDue();
            if (statusChanged || percentageChanged) {
                changedProperties.add(new ChangedProperty(property, before, statusChanged, percentageChanged));
            } else {
                unchangedProperties.add(property);
            }
        }

        List<CanonicalProperty> removedProperties = new ArrayList<>();
        for (CanonicalProperty before : previousSide.byAccount().values()) {
            if (!currentSide.byAccount().containsKey(before.accountNumber())) {
                removedProperties.add(before);
            }
        }

        newProperties.sort(BY_ACCOUNT);
        removedProperties.sort(BY_ACCOUNT);
        unchangedProperties.sort(BY_ACCOUNT);
        changedProperties.sort(Comparator.comparing(ChangedProperty::accountNumber));

        log.info("Compared snapshots: new={}, removed={}, changed={}, unchanged={}",
                newProperties.size(), removedProperties.size(), changedProperties.size(), unchangedProperties.size());

        return new SnapshotComparison(
                newProperties,
                removedProperties,
                unchangedProperties,
                changedProperties,
                currentSide.duplicates(),
                previousSide.duplicates()
        );
    }

    private DedupedSide dedupe(List<CanonicalProperty> records, String side) {
        if (records == null || records.isEmpty()) {
            return new DedupedSide(Map.of(), 0);
        }

        Map<String, CanonicalProperty> byAccount = new HashMap<>(records.size() * 2);
        int duplicates = 0;
        for (CanonicalProperty record : records) {
            CanonicalProperty existing = byAccount.get(record.accountNumber());
            if (existing == null) {
                byAccount.put(record.accountNumber(), record);
                continue;
            }
            duplicates++;
            log.debug("Duplicate account {} in {} snapshot (rows {} and {})",
                    record.accountNumber(), side, existing.sourceRowIndex(), record.sourceRowIndex());
            if (record.sourceRowIndex() >= existing.sourceRowIndex()) {
                byAccount.put(record.accountNumber(), record);
            }
        }

        if (duplicates > 0) {
            log.warn("{} duplicate account record(s) in {} snapshot; kept the last row per account", duplicates, side);
        }
        return new DedupedSide(new TreeMap<>(byAccount), duplicates);
    }

    private record DedupedSide(Map<String, CanonicalProperty> byAccount, int duplicates) {
    }
}
