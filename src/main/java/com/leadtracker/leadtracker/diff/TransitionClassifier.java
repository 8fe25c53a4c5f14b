package com.leadtracker.leadtracker.diff;

import com.leadtracker.leadtracker.ingest.CanonicalProperty;
import com.leadtracker.leadtracker.ingest.IngestConstants;
import com.leadtracker.leadtracker.ingest.IngestProperties;
import com.leadtracker.leadtracker.ingest.PropertyStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns a snapshot partition into a {@link DiffReport}: transition buckets, new-lead tagging and
 * dead-lead inference for removed accounts.
 */
@Component
public class TransitionClassifier {

    private static final Logger log = LoggerFactory.getLogger(TransitionClassifier.class);

    private final IngestProperties ingestProperties;

    public TransitionClassifier(IngestProperties ingestProperties) {
        this.ingestProperties = ingestProperties;
    }

    public DiffReport classify(SnapshotComparison comparison, ForeclosureSignal foreclosureSignal) {
        ForeclosureSignal signal = foreclosureSignal == null ? ForeclosureSignal.empty() : foreclosureSignal;
        int cap = Math.max(0, ingestProperties.getSampleSize());

        List<NewPropertyEntry> newEntries = new ArrayList<>(comparison.newProperties().size());
        int newLeads = 0;
        for (CanonicalProperty property : comparison.newProperties()) {
            boolean newLead = property.status() == PropertyStatus.PENDING;
            if (newLead) {
                newLeads++;
            }
            newEntries.add(new NewPropertyEntry(property, newLead));
        }

        List<RemovedPropertyEntry> removedEntries = new ArrayList<>(comparison.removedProperties().size());
        int deadLeads = 0;
        for (CanonicalProperty property : comparison.removedProperties()) {
            RemovedPropertyEntry entry = signal.matches(property)
                    ? new RemovedPropertyEntry(property, RemovalResolution.UNRESOLVED, IngestConstants.AWAITING_SIGNAL_REASON)
                    : new RemovedPropertyEntry(property, RemovalResolution.PRESUMED_DEAD_LEAD, IngestConstants.DEAD_LEAD_REASON);
            if (entry.deadLead()) {
                deadLeads++;
            }
            removedEntries.add(entry);
        }

        Map<TransitionKey, List<String>> buckets = new TreeMap<>();
        List<ChangedPropertyEntry> changedEntries = new ArrayList<>(comparison.changedProperties().size());
        int statusChanges = 0;
        int percentageChanges = 0;
        int escalations = 0;
        int criticalChanges = 0;
        for (ChangedProperty change : comparison.changedProperties()) {
            ChangedPropertyEntry entry = ChangedPropertyEntry.from(change);
            changedEntries.add(entry);
            if (entry.percentageChanged()) {
                percentageChanges++;
            }
            if (!entry.statusChanged()) {
                continue;
            }
            statusChanges++;
            if (entry.escalation()) {
                escalations++;
            }
            if (entry.critical()) {
                criticalChanges++;
            }
            buckets.computeIfAbsent(new TransitionKey(entry.previousStatus(), entry.status()), key -> new ArrayList<>())
                    .add(entry.accountNumber());
        }

        List<StatusTransition> transitions = new ArrayList<>(buckets.size());
        for (Map.Entry<TransitionKey, List<String>> bucket : buckets.entrySet()) {
            TransitionKey key = bucket.getKey();
            List<String> accounts = bucket.getValue();
            transitions.add(new StatusTransition(
                    key.from(),
                    key.to(),
                    TransitionKind.of(key.from(), key.to()),
                    accounts.size(),
                    capped(accounts, Comparator.<String>naturalOrder(), cap)
            ));
        }

        DiffSummary summary = new DiffSummary(
                comparison.totalCurrent(),
                comparison.totalPrevious(),
                newEntries.size(),
                newLeads,
                removedEntries.size(),
                deadLeads,
                comparison.unchangedProperties().size(),
                statusChanges,
                percentageChanges,
                escalations,
                criticalChanges,
                comparison.duplicateCurrentAccounts(),
                comparison.duplicatePreviousAccounts()
        );

        log.info("Classified comparison: newLeads={}, deadLeads={}, escalations={}, critical={}",
                newLeads, deadLeads, escalations, criticalChanges);

        return new DiffReport(
                summary,
                transitions,
                capped(newEntries, Comparator.comparing((NewPropertyEntry entry) -> entry.property().accountNumber()), cap),
                capped(removedEntries, Comparator.comparing((RemovedPropertyEntry entry) -> entry.property().accountNumber()), cap),
                capped(changedEntries, Comparator.comparing(ChangedPropertyEntry::accountNumber), cap)
        );
    }

    private static <T> List<T> capped(List<T> items, Comparator<? super T> order, int cap) {
        List<T> sorted = new ArrayList<>(items);
        sorted.sort(order);
        return sorted.size() <= cap ? sorted : new ArrayList<>(sorted.subList(0, cap));
    }

    private record TransitionKey(PropertyStatus from, PropertyStatus to) implements Comparable<TransitionKey> {

        @Override
        public int compareTo(TransitionKey other) {
            int byFrom = from.compareTo(other.from);
            return byFrom != 0 ? byFrom : to.compareTo(other.to);
        }
    }
}
