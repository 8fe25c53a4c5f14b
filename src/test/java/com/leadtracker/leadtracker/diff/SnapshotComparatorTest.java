package com.leadtracker.leadtracker.diff;

import com.leadtracker.leadtracker.ingest.CanonicalProperty;
import com.leadtracker.leadtracker.ingest.PropertyStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotComparatorTest {

    private final SnapshotComparator comparator = new SnapshotComparator();

    @Test
    void shouldDetectEscalatedAccount() {
        SnapshotComparison comparison = comparator.compare(
                List.of(property("900", PropertyStatus.ACTIVE, 0, 0)),
                List.of(property("900", PropertyStatus.PENDING, 0, 0))
        );

        assertEquals(1, comparison.changedProperties().size());
        ChangedProperty change = comparison.changedProperties().get(0);
        assertEquals(PropertyStatus.PENDING, change.previousStatus());
        assertTrue(change.statusChanged());
        assertFalse(change.percentageChanged());
    }

    @Test
    void shouldDetectRemovedAccount() {
        SnapshotComparison comparison = comparator.compare(
                List.of(property("100", PropertyStatus.ACTIVE, 0, 0)),
                List.of(property("100", PropertyStatus.ACTIVE, 0, 0), property("777", PropertyStatus.ACTIVE, 0, 1))
        );

        assertEquals(1, comparison.removedProperties().size());
        assertEquals("777", comparison.removedProperties().get(0).accountNumber());
        assertEquals(1, comparison.unchangedProperties().size());
    }

    @Test
    void shouldTreatEveryRecordAsNewWithoutPrevious() {
        List<CanonicalProperty> current = List.of(
                property("1", PropertyStatus.PENDING, 0, 0),
                property("2", PropertyStatus.ACTIVE, 0, 1)
        );

        assertEquals(2, comparator.compare(current, null).newProperties().size());
        assertEquals(2, comparator.compare(current, List.of()).newProperties().size());
        assertTrue(comparator.compare(current, null).removedProperties().isEmpty());
    }

    @Test
    void shouldFlagPercentageChangeOnExactDifferenceOnly() {
        SnapshotComparison comparison = comparator.compare(
                List.of(property("1", PropertyStatus.ACTIVE, 12.5, 0), property("2", PropertyStatus.ACTIVE, 10.0, 1)),
                List.of(property("1", PropertyStatus.ACTIVE, 12.5, 0), property("2", PropertyStatus.ACTIVE, 10.01, 1))
        );

        assertEquals(1, comparison.changedProperties().size());
        assertEquals("2", comparison.changedProperties().get(0).accountNumber());
        assertTrue(comparison.changedProperties().get(0).percentageChanged());
        assertFalse(comparison.changedProperties().get(0).statusChanged());
    }

    @Test
    void shouldKeepLastRowForDuplicateAccountsRegardlessOfInputOrder() {
        CanonicalProperty earlier = property("5", PropertyStatus.PENDING, 0, 3);
        CanonicalProperty later = property("5", PropertyStatus.JUDGMENT, 0, 9);
        List<CanonicalProperty> previous = List.of(property("5", PropertyStatus.ACTIVE, 0, 0));

        SnapshotComparison inOrder = comparator.compare(List.of(earlier, later), previous);
        SnapshotComparison reversed = comparator.compare(List.of(later, earlier), previous);

        assertEquals(1, inOrder.duplicateCurrentAccounts());
        assertEquals(PropertyStatus.JUDGMENT, inOrder.changedProperties().get(0).current().status());
        assertEquals(inOrder, reversed);
    }

    @Test
    void shouldPartitionEveryAccountExactlyOnce() {
        List<CanonicalProperty> previous = new ArrayList<>();
        List<CanonicalProperty> current = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            previous.add(property("acct-" + i, PropertyStatus.PENDING, i, i));
        }
        for (int i = 10; i < 30; i++) {
            PropertyStatus status = i % 3 == 0 ? PropertyStatus.ACTIVE : PropertyStatus.PENDING;
            current.add(property("acct-" + i, status, i, i));
        }
        current.add(property("acct-12", PropertyStatus.PENDING, 12, 99));

        SnapshotComparison comparison = comparator.compare(current, previous);

        Set<String> seen = new HashSet<>();
        comparison.newProperties().forEach(p -> assertTrue(seen.add(p.accountNumber())));
        comparison.unchangedProperties().forEach(p -> assertTrue(seen.add(p.accountNumber())));
        comparison.changedProperties().forEach(c -> assertTrue(seen.add(c.accountNumber())));
        assertEquals(20, seen.size());
        assertEquals(20, comparison.totalCurrent());
        assertEquals(20, comparison.totalPrevious());
        assertEquals(10, comparison.removedProperties().size());
        comparison.removedProperties().forEach(p -> assertFalse(seen.contains(p.accountNumber())));

        List<CanonicalProperty> shuffled = new ArrayList<>(current);
        Collections.shuffle(shuffled, new Random(7));
        List<CanonicalProperty> shuffledPrevious = new ArrayList<>(previous);
        Collections.reverse(shuffledPrevious);
        assertEquals(comparison, comparator.compare(shuffled, shuffledPrevious));
    }

    static CanonicalProperty property(String account, PropertyStatus status, double percentageDue, int row) {
        return CanonicalProperty.builder(account)
                .ownerName("Owner " + account)
                .propertyAddress(account + " Main St")
                .status(status)
                .percentageDue(percentageDue)
                .sourceRowIndex(row)
                .build();
    }
}
