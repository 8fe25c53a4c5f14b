package com.leadtracker.leadtracker.diff;

import com.leadtracker.leadtracker.ingest.CanonicalProperty;
import com.leadtracker.leadtracker.ingest.IngestConstants;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Accounts and addresses known to be in foreclosure or sold, used to tell dead leads from removals
 * that have another explanation.
 */
public record ForeclosureSignal(Set<String> accountNumbers, Set<String> normalizedAddresses) {

    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9_\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern STREET_TYPE = Pattern.compile(
            "\\b(street|st|avenue|ave|road|rd|drive|dr|lane|ln|court|ct|boulevard|blvd)\\b");

    public ForeclosureSignal {
        accountNumbers = accountNumbers == null ? Set.of() : Set.copyOf(accountNumbers);
        normalizedAddresses = normalizedAddresses == null ? Set.of() : Set.copyOf(normalizedAddresses);
    }

    public static ForeclosureSignal empty() {
        return new ForeclosureSignal(Set.of(), Set.of());
    }

    /**
     * Builds a signal from raw account numbers and raw addresses; blanks are ignored.
     */
    public static ForeclosureSignal of(Collection<String> accountNumbers, Collection<String> addresses) {
        Set<String> accounts = new HashSet<>();
        if (accountNumbers != null) {
            for (String accountNumber : accountNumbers) {
                if (accountNumber != null && !accountNumber.isBlank()) {
                    accounts.add(accountNumber.trim());
                }
            }
        }
        Set<String> normalized = new HashSet<>();
        if (addresses != null) {
            for (String address : addresses) {
                String value = normalizeAddress(address);
                if (!value.isEmpty()) {
                    normalized.add(value);
                }
            }
        }
        return new ForeclosureSignal(accounts, normalized);
    }

    public boolean matches(CanonicalProperty property) {
        if (accountNumbers.contains(property.accountNumber())) {
            return true;
        }
        if (IngestConstants.UNKNOWN_VALUE.equals(property.propertyAddress())) {
            return false;
        }
        String address = normalizeAddress(property.propertyAddress());
        return !address.isEmpty() && normalizedAddresses.contains(address);
    }

    /**
     * Lowercases, strips punctuation, drops street-type words and collapses whitespace.
     */
    public static String normalizeAddress(String address) {
        if (address == null) {
            return "";
        }
        String value = address.toLowerCase(Locale.ROOT);
        value = NON_WORD.matcher(value).replaceAll("");
        value = WHITESPACE.matcher(value).replaceAll(" ").trim();
        value = STREET_TYPE.matcher(value).replaceAll("");
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }
}
